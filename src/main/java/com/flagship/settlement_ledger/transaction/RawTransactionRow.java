package com.flagship.settlement_ledger.transaction;

import lombok.Value;

/**
 * A CSV row as read, before any validation. Fields are trimmed;
 * a column that is absent from the row is {@code null}.
 */
@Value
public class RawTransactionRow {
    long rowNumber;
    String type;
    String client;
    String tx;
    String amount;
}
