package com.momoledger.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of transaction categories. Labels are persisted and reported verbatim.
 */
public enum TransactionCategory {
    INCOMING_MONEY("Incoming Money"),
    BANK_TRANSFERS("Bank Transfers"),
    PAYMENTS_TO_CODE_HOLDERS("Payments to Code Holders"),
    TRANSFERS_TO_MOBILE_NUMBERS("Transfers to Mobile Numbers"),
    BANK_DEPOSITS("Bank Deposits"),
    AIRTIME_BILL_PAYMENTS("Airtime Bill Payments"),
    CASH_POWER_BILL_PAYMENTS("Cash Power Bill Payments"),
    WITHDRAWALS_FROM_AGENTS("Withdrawals from Agents"),
    INTERNET_AND_VOICE_BUNDLE_PURCHASES("Internet and Voice Bundle Purchases"),
    TRANSACTIONS_INITIATED_BY_THIRD_PARTIES("Transactions Initiated by Third Parties"),
    OTHER("Other"),
    UNKNOWN("Unknown");

    private final String label;

    TransactionCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<TransactionCategory> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return Arrays.stream(values()).filter(c -> c.label.equals(label)).findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
