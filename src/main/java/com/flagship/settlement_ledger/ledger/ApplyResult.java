package com.flagship.settlement_ledger.ledger;

import java.util.Optional;

/**
 * Outcome of applying one record: applied, or rejected with a {@link TransactionError}.
 */
public final class ApplyResult {

    private static final ApplyResult APPLIED = new ApplyResult(null);

    private final TransactionError error;

    private ApplyResult(TransactionError error) {
        this.error = error;
    }

    public static ApplyResult applied() {
        return APPLIED;
    }

    public static ApplyResult rejected(TransactionError error) {
        if (error == null) {
            throw new IllegalArgumentException("Rejection requires an error");
        }
        return new ApplyResult(error);
    }

    public boolean isApplied() {
        return error == null;
    }

    public boolean isRejected() {
        return error != null;
    }

    public Optional<TransactionError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isApplied() ? "ApplyResult[applied]" : "ApplyResult[rejected: " + error + "]";
    }
}
