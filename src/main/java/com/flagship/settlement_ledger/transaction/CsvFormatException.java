package com.flagship.settlement_ledger.transaction;

import java.io.IOException;

/**
 * The input as a whole is not a usable transaction CSV
 * (empty input, or a header without a required column).
 */
public class CsvFormatException extends IOException {

    public CsvFormatException(String message) {
        super(message);
    }
}
