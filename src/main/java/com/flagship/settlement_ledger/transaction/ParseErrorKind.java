package com.flagship.settlement_ledger.transaction;

/**
 * Reasons a CSV row cannot become a {@link TransactionRecord}.
 */
public enum ParseErrorKind {
    UNKNOWN_TYPE,
    MISSING_FIELD,
    INVALID_CLIENT_ID,
    INVALID_TRANSACTION_ID,
    INVALID_AMOUNT,
    NEGATIVE_AMOUNT,
    MISSING_AMOUNT,
    SUPERFLUOUS_AMOUNT
}
