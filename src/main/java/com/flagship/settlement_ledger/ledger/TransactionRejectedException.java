package com.flagship.settlement_ledger.ledger;

import lombok.Getter;

/**
 * Raised inside the engine when a business rule rejects a record.
 * {@link TransactionEngine#apply} turns it into {@link ApplyResult#rejected}.
 */
@Getter
public class TransactionRejectedException extends RuntimeException {

    private final TransactionError error;

    public TransactionRejectedException(TransactionError error) {
        super(error.getMessage());
        this.error = error;
    }

    public TransactionErrorKind getKind() {
        return error.getKind();
    }
}
