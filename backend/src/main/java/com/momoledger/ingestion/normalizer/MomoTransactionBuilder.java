package com.momoledger.ingestion.normalizer;

import com.momoledger.domain.MomoTransaction;
import com.momoledger.domain.RawSms;
import com.momoledger.domain.TransactionCategory;
import com.momoledger.ingestion.classifier.Counterparty;
import com.momoledger.ingestion.classifier.CounterpartyResolver;
import com.momoledger.ingestion.classifier.SmsClassifier;
import com.momoledger.ingestion.extractor.ReadableDateParser;
import com.momoledger.ingestion.extractor.SmsFieldExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Builds a {@link MomoTransaction} from one raw SMS. Never fails: a field that cannot be extracted
 * takes its default (0 for amount and fee, null otherwise). Does not persist anything.
 */
@Component
@RequiredArgsConstructor
public class MomoTransactionBuilder {

    /** Stands in for a missing body so extractors always see text. */
    public static final String NO_BODY_PLACEHOLDER = "No Body provided";
    static final String DEFAULT_SMS_TYPE = "unknown";

    private final SmsClassifier smsClassifier;
    private final CounterpartyResolver counterpartyResolver;
    private final Clock clock;

    public MomoTransaction build(RawSms sms) {
        Instant now = clock.instant();
        String body = sms.hasBody() ? sms.getBody() : NO_BODY_PLACEHOLDER;
        TransactionCategory category = sms.hasBody() ? smsClassifier.classify(body) : TransactionCategory.UNKNOWN;
        Counterparty counterparty = counterpartyResolver.resolve(body, category);

        MomoTransaction tx = new MomoTransaction();
        tx.setCategory(category);
        tx.setAmount(SmsFieldExtractor.extractAmount(body).orElse(0L));
        tx.setCurrency(SmsFieldExtractor.CURRENCY);
        tx.setOccurredAt(resolveOccurredAt(body, sms.getReadableDate(), now));
        tx.setSender(counterparty.sender());
        tx.setReceiver(counterparty.receiver());
        tx.setBalance(SmsFieldExtractor.extractBalance(body).orElse(null));
        tx.setFee(SmsFieldExtractor.extractFee(body).orElse(0L));
        tx.setTransactionId(SmsFieldExtractor.extractTransactionId(body).orElse(null));
        tx.setExternalTransactionId(SmsFieldExtractor.extractExternalTransactionId(body).orElse(null));
        tx.setRawBody(body);
        tx.setSourceMessage(sms.getAttributes());
        tx.setAddress(sms.getAddress() != null ? sms.getAddress() : "");
        tx.setSmsType(sms.getType() != null && !sms.getType().isEmpty() ? sms.getType() : DEFAULT_SMS_TYPE);
        tx.setReadableDate(emptyToNull(sms.getReadableDate()));
        tx.setContactName(emptyToNull(sms.getContactName()));
        tx.setCreatedAt(now);
        return tx;
    }

    /** Date in the body, then readable_date, then ingestion time. */
    private static Instant resolveOccurredAt(String body, String readableDate, Instant now) {
        return SmsFieldExtractor.extractDate(body)
                .or(() -> ReadableDateParser.parse(readableDate))
                .orElse(now);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
