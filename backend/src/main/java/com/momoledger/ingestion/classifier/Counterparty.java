package com.momoledger.ingestion.classifier;

/**
 * Sender or receiver named in a message. At most one side is set.
 */
public record Counterparty(String sender, String receiver) {

    public static final Counterparty NONE = new Counterparty(null, null);

    public Counterparty {
        if (sender != null && receiver != null) {
            throw new IllegalArgumentException("sender and receiver are mutually exclusive");
        }
    }

    public static Counterparty sender(String name) {
        return name == null ? NONE : new Counterparty(name, null);
    }

    public static Counterparty receiver(String name) {
        return name == null ? NONE : new Counterparty(null, name);
    }
}
