package com.flagship.settlement_ledger.transaction;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of a transaction record.
 *
 * Deposits and withdrawals move funds and carry an amount.
 * The other three kinds act on an earlier deposit or withdrawal
 * and never carry an amount of their own.
 */
public enum TransactionType {
    /**
     * Credits the client's available funds.
     */
    DEPOSIT("deposit", true),

    /**
     * Debits the client's available funds.
     */
    WITHDRAWAL("withdrawal", true),

    /**
     * Provisionally reverses an earlier transaction: its amount moves
     * from available to held.
     */
    DISPUTE("dispute", false),

    /**
     * Cancels an open dispute: the held amount returns to available.
     */
    RESOLVE("resolve", false),

    /**
     * Finalizes an open dispute against the client.
     * The held amount leaves the account and the account is locked.
     */
    CHARGEBACK("chargeback", false);

    private final String value;
    private final boolean carriesAmount;

    TransactionType(String value, boolean carriesAmount) {
        this.value = value;
        this.carriesAmount = carriesAmount;
    }

    public String getValue() {
        return value;
    }

    public boolean carriesAmount() {
        return carriesAmount;
    }

    /**
     * Looks up a type by its CSV spelling, ignoring case.
     */
    public static Optional<TransactionType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
