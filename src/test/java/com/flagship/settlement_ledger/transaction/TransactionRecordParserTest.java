package com.flagship.settlement_ledger.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRecordParserTest {

    private final TransactionRecordParser parser = new TransactionRecordParser();

    private static RawTransactionRow row(String type, String client, String tx, String amount) {
        return new RawTransactionRow(1, type, client, tx, amount);
    }

    private void assertParseError(RawTransactionRow row, ParseErrorKind expected) {
        RecordParseException exception = assertThrows(RecordParseException.class, () -> parser.parse(row));
        assertEquals(expected, exception.getKind(), exception.getMessage());
    }

    @Test
    @DisplayName("Deposit row becomes a funds movement with its amount")
    void parsesDeposit() {
        TransactionRecord record = parser.parse(row("deposit", "1", "2", "1.5"));

        FundsMovement deposit = assertInstanceOf(FundsMovement.class, record);
        assertEquals(TransactionType.DEPOSIT, deposit.getType());
        assertEquals(1, deposit.getClientId());
        assertEquals(2L, deposit.getTransactionId());
        assertEquals(new BigDecimal("1.5"), deposit.getAmount());
    }

    @Test
    @DisplayName("Type is matched case-insensitively")
    void typeIgnoresCase() {
        TransactionRecord record = parser.parse(row("WithDrawal", "3", "4", "0.25"));

        assertEquals(TransactionType.WITHDRAWAL, record.getType());
    }

    @Test
    @DisplayName("Dispute, resolve and chargeback rows carry no amount")
    void parsesDisputeActions() {
        assertEquals(TransactionType.DISPUTE, assertInstanceOf(DisputeAction.class,
            parser.parse(row("dispute", "1", "1", null))).getType());
        assertEquals(TransactionType.RESOLVE, assertInstanceOf(DisputeAction.class,
            parser.parse(row("resolve", "1", "1", ""))).getType());
        assertEquals(TransactionType.CHARGEBACK, assertInstanceOf(DisputeAction.class,
            parser.parse(row("chargeback", "1", "1", "  "))).getType());
    }

    @Test
    @DisplayName("Zero is a valid amount")
    void zeroAmount() {
        FundsMovement record = (FundsMovement) parser.parse(row("deposit", "1", "1", "0"));

        assertEquals(0, record.getAmount().signum());
    }

    @Test
    @DisplayName("Largest client and transaction ids are accepted")
    void idBounds() {
        TransactionRecord record = parser.parse(row("dispute", "65535", "4294967295", null));

        assertEquals(65535, record.getClientId());
        assertEquals(4294967295L, record.getTransactionId());
    }

    @Test
    @DisplayName("Unknown type is rejected")
    void unknownType() {
        assertParseError(row("transfer", "1", "1", "1"), ParseErrorKind.UNKNOWN_TYPE);
    }

    @Test
    @DisplayName("Empty mandatory columns are rejected")
    void missingFields() {
        assertParseError(row("", "1", "1", "1"), ParseErrorKind.MISSING_FIELD);
        assertParseError(row("deposit", null, "1", "1"), ParseErrorKind.MISSING_FIELD);
        assertParseError(row("deposit", "1", " ", "1"), ParseErrorKind.MISSING_FIELD);
    }

    @Test
    @DisplayName("Client ids outside 0..65535 are rejected")
    void invalidClientId() {
        assertParseError(row("deposit", "65536", "1", "1"), ParseErrorKind.INVALID_CLIENT_ID);
        assertParseError(row("deposit", "-1", "1", "1"), ParseErrorKind.INVALID_CLIENT_ID);
        assertParseError(row("deposit", "one", "1", "1"), ParseErrorKind.INVALID_CLIENT_ID);
    }

    @Test
    @DisplayName("Transaction ids outside the 32-bit unsigned range are rejected")
    void invalidTransactionId() {
        assertParseError(row("deposit", "1", "4294967296", "1"), ParseErrorKind.INVALID_TRANSACTION_ID);
        assertParseError(row("deposit", "1", "1.0", "1"), ParseErrorKind.INVALID_TRANSACTION_ID);
    }

    @Test
    @DisplayName("Deposits and withdrawals need a non-negative decimal amount")
    void amountRules() {
        assertParseError(row("deposit", "1", "1", null), ParseErrorKind.MISSING_AMOUNT);
        assertParseError(row("withdrawal", "1", "1", ""), ParseErrorKind.MISSING_AMOUNT);
        assertParseError(row("deposit", "1", "1", "ten"), ParseErrorKind.INVALID_AMOUNT);
        assertParseError(row("withdrawal", "1", "1", "-0.01"), ParseErrorKind.NEGATIVE_AMOUNT);
    }

    @Test
    @DisplayName("Amounts must be plain decimals of at most 28 digits")
    void amountNotation() {
        assertParseError(row("deposit", "1", "1", "1E+999999999"), ParseErrorKind.INVALID_AMOUNT);
        assertParseError(row("deposit", "1", "1", "1e3"), ParseErrorKind.INVALID_AMOUNT);
        assertParseError(row("deposit", "1", "1", "+1.0"), ParseErrorKind.INVALID_AMOUNT);
        assertParseError(row("deposit", "1", "1", "1."), ParseErrorKind.INVALID_AMOUNT);
        assertParseError(row("deposit", "1", "1", "1".repeat(29)), ParseErrorKind.INVALID_AMOUNT);
        assertParseError(row("deposit", "1", "1", "0." + "0".repeat(28) + "1"), ParseErrorKind.INVALID_AMOUNT);

        FundsMovement widest = (FundsMovement) parser.parse(row("deposit", "1", "1", "9".repeat(28)));
        assertEquals(new BigDecimal("9".repeat(28)), widest.getAmount());
    }

    @Test
    @DisplayName("Dispute actions with an amount are rejected")
    void superfluousAmount() {
        assertParseError(row("dispute", "1", "1", "1.0"), ParseErrorKind.SUPERFLUOUS_AMOUNT);
        assertParseError(row("chargeback", "1", "1", "0"), ParseErrorKind.SUPERFLUOUS_AMOUNT);
    }

    @Test
    @DisplayName("Records cannot be built in an inconsistent shape")
    void factoriesGuardShape() {
        assertThrows(IllegalArgumentException.class,
            () -> TransactionRecord.deposit(1, 1, new BigDecimal("-1")));
        assertThrows(NullPointerException.class,
            () -> TransactionRecord.withdrawal(1, 1, null));
        assertThrows(IllegalArgumentException.class,
            () -> TransactionRecord.dispute(70000, 1));
    }
}
