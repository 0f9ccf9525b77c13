package com.flagship.settlement_ledger.transaction;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Turns raw CSV rows into {@link TransactionRecord}s.
 *
 * This is the only place where field formats and the amount/type pairing
 * are checked. Anything that passes here is structurally valid, so the
 * ledger only has to apply business rules.
 */
@Component
public class TransactionRecordParser {

    /** Plain decimal notation only: no exponent, no sign other than a leading minus. */
    private static final Pattern AMOUNT_PATTERN = Pattern.compile("-?\\d+(\\.\\d+)?");

    static final int MAX_AMOUNT_DIGITS = 28;

    /**
     * Converts one row.
     *
     * @param row raw, trimmed row
     * @return the validated record
     * @throws RecordParseException if the row does not describe a legal record
     */
    public TransactionRecord parse(RawTransactionRow row) {
        String typeValue = requireField(row.getType(), "type", row);
        TransactionType type = TransactionType.fromValue(typeValue)
            .orElseThrow(() -> new RecordParseException(ParseErrorKind.UNKNOWN_TYPE,
                String.format("Row %d: unknown transaction type '%s'", row.getRowNumber(), typeValue)));

        int clientId = parseClientId(requireField(row.getClient(), "client", row), row);
        long transactionId = parseTransactionId(requireField(row.getTx(), "tx", row), row);
        String amountValue = blankToNull(row.getAmount());

        if (!type.carriesAmount() && amountValue != null) {
            throw new RecordParseException(ParseErrorKind.SUPERFLUOUS_AMOUNT,
                String.format("Row %d: %s for transaction %d must not carry an amount",
                    row.getRowNumber(), type.getValue(), transactionId));
        }

        return switch (type) {
            case DEPOSIT -> TransactionRecord.deposit(clientId, transactionId,
                parseAmount(amountValue, type, transactionId, row));
            case WITHDRAWAL -> TransactionRecord.withdrawal(clientId, transactionId,
                parseAmount(amountValue, type, transactionId, row));
            case DISPUTE -> TransactionRecord.dispute(clientId, transactionId);
            case RESOLVE -> TransactionRecord.resolve(clientId, transactionId);
            case CHARGEBACK -> TransactionRecord.chargeback(clientId, transactionId);
        };
    }

    private int parseClientId(String value, RawTransactionRow row) {
        long parsed = parseUnsigned(value, TransactionRecord.MAX_CLIENT_ID,
            ParseErrorKind.INVALID_CLIENT_ID, "client id", row);
        return (int) parsed;
    }

    private long parseTransactionId(String value, RawTransactionRow row) {
        return parseUnsigned(value, TransactionRecord.MAX_TRANSACTION_ID,
            ParseErrorKind.INVALID_TRANSACTION_ID, "transaction id", row);
    }

    private long parseUnsigned(String value, long max, ParseErrorKind kind,
                               String label, RawTransactionRow row) {
        long parsed;
        try {
            parsed = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new RecordParseException(kind,
                String.format("Row %d: %s '%s' is not an integer", row.getRowNumber(), label, value), e);
        }
        if (parsed < 0 || parsed > max) {
            throw new RecordParseException(kind,
                String.format("Row %d: %s %d is outside 0..%d", row.getRowNumber(), label, parsed, max));
        }
        return parsed;
    }

    private BigDecimal parseAmount(String value, TransactionType type, long transactionId,
                                   RawTransactionRow row) {
        if (value == null) {
            throw new RecordParseException(ParseErrorKind.MISSING_AMOUNT,
                String.format("Row %d: %s for transaction %d has no amount",
                    row.getRowNumber(), type.getValue(), transactionId));
        }
        if (!AMOUNT_PATTERN.matcher(value).matches()) {
            throw new RecordParseException(ParseErrorKind.INVALID_AMOUNT,
                String.format("Row %d: amount '%s' is not a plain decimal number", row.getRowNumber(), value));
        }
        BigDecimal amount = new BigDecimal(value);
        if (amount.precision() > MAX_AMOUNT_DIGITS || amount.scale() > MAX_AMOUNT_DIGITS) {
            throw new RecordParseException(ParseErrorKind.INVALID_AMOUNT,
                String.format("Row %d: amount '%s' exceeds %d digits", row.getRowNumber(), value, MAX_AMOUNT_DIGITS));
        }
        if (amount.signum() < 0) {
            throw new RecordParseException(ParseErrorKind.NEGATIVE_AMOUNT,
                String.format("Row %d: amount %s for transaction %d is negative",
                    row.getRowNumber(), amount.toPlainString(), transactionId));
        }
        return amount;
    }

    private String requireField(String value, String column, RawTransactionRow row) {
        String normalized = blankToNull(value);
        if (normalized == null) {
            throw new RecordParseException(ParseErrorKind.MISSING_FIELD,
                String.format("Row %d: column '%s' is empty", row.getRowNumber(), column));
        }
        return normalized;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
