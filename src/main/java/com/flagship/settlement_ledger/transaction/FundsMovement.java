package com.flagship.settlement_ledger.transaction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A deposit or a withdrawal. Always carries a non-negative amount.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class FundsMovement extends TransactionRecord {

    private final BigDecimal amount;

    FundsMovement(TransactionType type, int clientId, long transactionId, BigDecimal amount) {
        super(type, clientId, transactionId);
        if (!type.carriesAmount()) {
            throw new IllegalArgumentException(type + " does not move funds");
        }
        this.amount = Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
    }
}
