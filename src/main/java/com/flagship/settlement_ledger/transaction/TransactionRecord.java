package com.flagship.settlement_ledger.transaction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One validated row of the transaction stream.
 *
 * Records only come into existence through the static factories below,
 * which pair every {@link TransactionType} with the right shape:
 * {@link FundsMovement} for deposits and withdrawals (with an amount),
 * {@link DisputeAction} for disputes, resolves and chargebacks (without one).
 * Consumers therefore never need to re-check structural validity.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TRANSACTION_ID = 0xFFFF_FFFFL;

    private final TransactionType type;
    private final int clientId;
    private final long transactionId;

    TransactionRecord(TransactionType type, int clientId, long transactionId) {
        this.type = Objects.requireNonNull(type, "type");
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
        if (transactionId < 0 || transactionId > MAX_TRANSACTION_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + transactionId);
        }
        this.clientId = clientId;
        this.transactionId = transactionId;
    }

    public static FundsMovement deposit(int clientId, long transactionId, BigDecimal amount) {
        return new FundsMovement(TransactionType.DEPOSIT, clientId, transactionId, amount);
    }

    public static FundsMovement withdrawal(int clientId, long transactionId, BigDecimal amount) {
        return new FundsMovement(TransactionType.WITHDRAWAL, clientId, transactionId, amount);
    }

    public static DisputeAction dispute(int clientId, long transactionId) {
        return new DisputeAction(TransactionType.DISPUTE, clientId, transactionId);
    }

    public static DisputeAction resolve(int clientId, long transactionId) {
        return new DisputeAction(TransactionType.RESOLVE, clientId, transactionId);
    }

    public static DisputeAction chargeback(int clientId, long transactionId) {
        return new DisputeAction(TransactionType.CHARGEBACK, clientId, transactionId);
    }
}
