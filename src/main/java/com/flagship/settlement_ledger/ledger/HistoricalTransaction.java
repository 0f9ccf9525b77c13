package com.flagship.settlement_ledger.ledger;

import com.flagship.settlement_ledger.transaction.FundsMovement;
import com.flagship.settlement_ledger.transaction.TransactionType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A deposit or withdrawal that was applied, kept so it can be disputed later.
 */
@Value
public class HistoricalTransaction {
    long transactionId;
    int clientId;
    BigDecimal amount;
    TransactionType type;

    static HistoricalTransaction of(FundsMovement movement) {
        return new HistoricalTransaction(
            movement.getTransactionId(),
            movement.getClientId(),
            movement.getAmount(),
            movement.getType()
        );
    }
}
