package com.flagship.settlement_ledger.transaction;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A dispute, resolve or chargeback. Refers to an earlier deposit or
 * withdrawal through its transaction id and has no amount of its own.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class DisputeAction extends TransactionRecord {

    DisputeAction(TransactionType type, int clientId, long transactionId) {
        super(type, clientId, transactionId);
        if (type.carriesAmount()) {
            throw new IllegalArgumentException(type + " must carry an amount");
        }
    }
}
