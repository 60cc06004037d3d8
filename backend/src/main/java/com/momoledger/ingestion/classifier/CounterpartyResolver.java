package com.momoledger.ingestion.classifier;

import com.momoledger.domain.TransactionCategory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the sender (Incoming Money) or receiver (payments to code holders, transfers to mobile numbers)
 * from a body that has already been classified.
 */
@Component
public class CounterpartyResolver {

    /** "... from Jane Smith (*********013) ..." */
    private static final Pattern SENDER = Pattern.compile("from ([^(]+) \\(");
    /** "... to Jane Smith 12845 ..." or "... to Samuel Carter (250791666666) ..."; the name stops at a digit or "(". */
    private static final Pattern RECEIVER = Pattern.compile("to ([^\\d(]+)(?:\\d|\\()");

    public Counterparty resolve(String body, TransactionCategory category) {
        if (body == null || category == null) {
            return Counterparty.NONE;
        }
        return switch (category) {
            case INCOMING_MONEY -> Counterparty.sender(firstGroupTrimmed(SENDER, body));
            case PAYMENTS_TO_CODE_HOLDERS, TRANSFERS_TO_MOBILE_NUMBERS ->
                    Counterparty.receiver(firstGroupTrimmed(RECEIVER, body));
            default -> Counterparty.NONE;
        };
    }

    private static String firstGroupTrimmed(Pattern pattern, String body) {
        Matcher m = pattern.matcher(body);
        if (!m.find()) return null;
        String value = m.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
