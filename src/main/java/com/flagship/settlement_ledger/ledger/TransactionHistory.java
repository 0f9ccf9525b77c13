package com.flagship.settlement_ledger.ledger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applied deposits and withdrawals by transaction id.
 * Entries are never removed, so a resolved transaction keeps its amount.
 */
public class TransactionHistory {

    private final Map<Long, HistoricalTransaction> entries = new HashMap<>();

    void record(HistoricalTransaction transaction) {
        HistoricalTransaction previous = entries.putIfAbsent(transaction.getTransactionId(), transaction);
        if (previous != null) {
            throw new IllegalStateException("Transaction " + transaction.getTransactionId() + " already recorded");
        }
    }

    public boolean contains(long transactionId) {
        return entries.containsKey(transactionId);
    }

    public Optional<HistoricalTransaction> find(long transactionId) {
        return Optional.ofNullable(entries.get(transactionId));
    }

    public int size() {
        return entries.size();
    }
}
