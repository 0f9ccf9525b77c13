package com.flagship.settlement_ledger.ledger;

import com.flagship.settlement_ledger.transaction.TransactionRecord;
import com.flagship.settlement_ledger.transaction.TransactionType;
import lombok.Value;

/**
 * Why a particular record was rejected.
 */
@Value
public class TransactionError {
    TransactionErrorKind kind;
    TransactionType type;
    int clientId;
    long transactionId;
    String message;

    static TransactionError of(TransactionErrorKind kind, TransactionRecord record, String message) {
        return new TransactionError(kind, record.getType(), record.getClientId(),
            record.getTransactionId(), message);
    }
}
