package com.flagship.settlement_ledger.ledger;

/**
 * Reasons the engine rejects a structurally valid record.
 * Every kind is local to one record; none of them stops a replay.
 */
public enum TransactionErrorKind {
    /**
     * Deposit or withdrawal reuses an existing transaction id.
     */
    DUPLICATE_TRANSACTION,

    /**
     * Withdrawal exceeds the available balance.
     */
    INSUFFICIENT_FUNDS,

    /**
     * The account was locked by a chargeback.
     */
    ACCOUNT_LOCKED,

    /**
     * Dispute references a transaction id that was never applied.
     */
    TRANSACTION_NOT_FOUND,

    /**
     * Dispute references a transaction that is already disputed.
     */
    ALREADY_DISPUTED,

    /**
     * Resolve or chargeback references a transaction that is not disputed.
     */
    TRANSACTION_NOT_DISPUTED,

    /**
     * The record's client does not own the referenced transaction.
     */
    CLIENT_MISMATCH,

    /**
     * Dispute references a transaction that was already charged back.
     */
    ALREADY_CHARGED_BACK
}
