package com.momoledger.ingestion.classifier;

import com.momoledger.domain.TransactionCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

import static com.momoledger.domain.TransactionCategory.AIRTIME_BILL_PAYMENTS;
import static com.momoledger.domain.TransactionCategory.BANK_DEPOSITS;
import static com.momoledger.domain.TransactionCategory.BANK_TRANSFERS;
import static com.momoledger.domain.TransactionCategory.CASH_POWER_BILL_PAYMENTS;
import static com.momoledger.domain.TransactionCategory.INCOMING_MONEY;
import static com.momoledger.domain.TransactionCategory.INTERNET_AND_VOICE_BUNDLE_PURCHASES;
import static com.momoledger.domain.TransactionCategory.PAYMENTS_TO_CODE_HOLDERS;
import static com.momoledger.domain.TransactionCategory.TRANSACTIONS_INITIATED_BY_THIRD_PARTIES;
import static com.momoledger.domain.TransactionCategory.TRANSFERS_TO_MOBILE_NUMBERS;
import static com.momoledger.domain.TransactionCategory.WITHDRAWALS_FROM_AGENTS;

/**
 * Assigns exactly one category to an SMS body. Rules are evaluated top to bottom and the first match wins,
 * so a message that both says "received ... from" and carries an External Transaction Id is Incoming Money.
 * Do not reorder {@link #RULES}.
 */
@Component
@Slf4j
public class SmsClassifier {

    private static final Pattern THIRD_PARTY_ACCOUNT = Pattern.compile("on your \\w+ account");
    private static final Pattern BUNDLE = Pattern.compile("Bundles and Packs|internet|voice bundle", Pattern.CASE_INSENSITIVE);

    static final List<ClassificationRule> RULES = List.of(
            ClassificationRule.containsAll(INCOMING_MONEY, "received", "from"),
            ClassificationRule.containsAll(PAYMENTS_TO_CODE_HOLDERS, "payment of", "to"),
            ClassificationRule.containsAll(TRANSFERS_TO_MOBILE_NUMBERS, "transferred to", "from"),
            ClassificationRule.containsAll(BANK_DEPOSITS, "bank deposit"),
            ClassificationRule.containsAll(AIRTIME_BILL_PAYMENTS, "Airtime"),
            ClassificationRule.containsAll(CASH_POWER_BILL_PAYMENTS, "Cash Power"),
            new ClassificationRule("by & on your <account> account",
                    body -> body.contains("by") && THIRD_PARTY_ACCOUNT.matcher(body).find(),
                    TRANSACTIONS_INITIATED_BY_THIRD_PARTIES),
            ClassificationRule.containsAll(WITHDRAWALS_FROM_AGENTS, "withdrawn", "agent"),
            ClassificationRule.containsAll(BANK_TRANSFERS, "External Transaction Id"),
            ClassificationRule.matches(INTERNET_AND_VOICE_BUNDLE_PURCHASES, BUNDLE)
    );

    /**
     * @param body SMS body; null or empty means the message had no body
     * @return never null; {@link TransactionCategory#UNKNOWN} for an absent body, {@link TransactionCategory#OTHER} when no rule matches
     */
    public TransactionCategory classify(String body) {
        if (body == null || body.isEmpty()) {
            return TransactionCategory.UNKNOWN;
        }
        for (ClassificationRule rule : RULES) {
            if (rule.matches(body)) {
                log.trace("Rule [{}] matched: {}", rule.name(), rule.category());
                return rule.category();
            }
        }
        return TransactionCategory.OTHER;
    }
}
