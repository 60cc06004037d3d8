package com.momoledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured transaction built from one mobile-money SMS.
 * Only values found in the message text are populated; the rest stay null (or zero for amount and fee).
 */
@Document(collection = "transactions")
@CompoundIndexes({
    @CompoundIndex(name = "category_occurredAt", def = "{'category': 1, 'occurredAt': -1}"),
    @CompoundIndex(name = "occurredAt_amount", def = "{'occurredAt': -1, 'amount': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MomoTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private TransactionCategory category;
    /** Whole currency units. */
    private long amount;
    private String currency;
    private Instant occurredAt;
    /** Populated for Incoming Money only. */
    private String sender;
    /** Populated for payments to code holders and transfers to mobile numbers only. */
    private String receiver;
    private Long balance;
    private long fee;
    private String transactionId;
    private String externalTransactionId;
    private String rawBody;
    private Map<String, String> sourceMessage = new LinkedHashMap<>();
    private String address;
    private String smsType;
    private String readableDate;
    private String contactName;
    private Instant createdAt;
}
