package com.flagship.settlement_ledger.ledger;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Transactions currently under dispute, plus the ones that ended in a chargeback.
 *
 * An id is opened by a dispute and closed by a resolve or a chargeback.
 * A transaction is never open and charged back at the same time.
 */
public class DisputeSet {

    private final Set<Long> open = new HashSet<>();
    private final Set<Long> chargedBack = new HashSet<>();

    void open(long transactionId) {
        if (!open.add(transactionId)) {
            throw new IllegalStateException("Transaction " + transactionId + " is already disputed");
        }
    }

    void resolve(long transactionId) {
        close(transactionId);
    }

    void chargeBack(long transactionId) {
        close(transactionId);
        chargedBack.add(transactionId);
    }

    private void close(long transactionId) {
        if (!open.remove(transactionId)) {
            throw new IllegalStateException("Transaction " + transactionId + " is not disputed");
        }
    }

    public boolean isDisputed(long transactionId) {
        return open.contains(transactionId);
    }

    public boolean isChargedBack(long transactionId) {
        return chargedBack.contains(transactionId);
    }

    public Set<Long> disputedIds() {
        return Collections.unmodifiableSet(open);
    }
}
