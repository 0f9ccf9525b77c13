package com.flagship.settlement_ledger.transaction;

import lombok.Getter;

/**
 * Thrown when a single row is not a legal transaction record.
 * Affects that row only; the rest of the stream is still readable.
 */
@Getter
public class RecordParseException extends RuntimeException {

    private final ParseErrorKind kind;

    public RecordParseException(ParseErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RecordParseException(ParseErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
