package com.flagship.settlement_ledger.replay;

import com.flagship.settlement_ledger.ledger.ClientAccount;
import com.flagship.settlement_ledger.ledger.TransactionErrorKind;
import com.flagship.settlement_ledger.output.AccountCsvWriter;
import com.flagship.settlement_ledger.transaction.CsvFormatException;
import com.flagship.settlement_ledger.transaction.ParseErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end replay tests: CSV in, ledger and account CSV out.
 *
 * These tests verify that:
 * - Rows are applied in file order
 * - Rejected and malformed rows are counted and skipped, never fatal
 * - Only an unusable input aborts the replay
 * - Replay outcomes show up in the metrics
 */
@SpringBootTest(properties = "replay.runner.enabled=false")
class ReplayServiceTest {

    @Autowired
    private ReplayService replayService;

    @Autowired
    private AccountCsvWriter accountWriter;

    @Autowired
    private MeterRegistry meterRegistry;

    private ReplayReport replay(String csv) throws IOException {
        return replayService.replay(new StringReader(csv));
    }

    private ClientAccount account(ReplayReport report, int clientId) {
        return report.getLedger().find(clientId)
            .orElseThrow(() -> new AssertionError("No account for client " + clientId));
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "Expected " + expected + ", actual " + actual);
    }

    private double counterValue(String name, String tagKey, String tagValue) {
        Counter counter = meterRegistry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("Deposits, withdrawals and a resolved dispute produce the expected balances")
    void replaysValidStream() throws IOException {
        String csv = "type, client, tx, amount\n"
            + "deposit, 1, 1, 1.0\n"
            + "deposit, 2, 2, 2.0\n"
            + "deposit, 1, 3, 2.0\n"
            + "withdrawal, 1, 4, 1.5\n"
            + "withdrawal, 2, 5, 3.0\n"
            + "dispute, 1, 1,\n"
            + "resolve, 1, 1,\n";

        ReplayReport report = replay(csv);

        assertEquals(7, report.getRowsRead());
        assertEquals(6, report.getApplied());
        assertEquals(1, report.getRejected());
        assertEquals(1, report.rejectionsOf(TransactionErrorKind.INSUFFICIENT_FUNDS));
        assertEquals(0, report.getMalformed());

        ClientAccount client1 = account(report, 1);
        assertAmount("1.5", client1.getAvailable());
        assertAmount("0", client1.getHeld());
        assertAmount("1.5", client1.getTotal());
        assertFalse(client1.isLocked());

        ClientAccount client2 = account(report, 2);
        assertAmount("2", client2.getAvailable());
        assertAmount("2", client2.getTotal());
    }

    @Test
    @DisplayName("Chargeback locks the account and later deposits are rejected")
    void chargebackLocksAccount() throws IOException {
        String csv = "type,client,tx,amount\n"
            + "deposit,1,1,10.0\n"
            + "dispute,1,1,\n"
            + "chargeback,1,1,\n"
            + "deposit,1,3,5.0\n";

        ReplayReport report = replay(csv);

        assertEquals(3, report.getApplied());
        assertEquals(1, report.rejectionsOf(TransactionErrorKind.ACCOUNT_LOCKED));
        ClientAccount account = account(report, 1);
        assertAmount("0", account.getAvailable());
        assertAmount("0", account.getHeld());
        assertTrue(account.isLocked());
    }

    @Test
    @DisplayName("Malformed rows and rejected records never stop the replay")
    void badRowsAreSkipped() throws IOException {
        double malformedBefore = counterValue("replay.rows.malformed", "reason", "SUPERFLUOUS_AMOUNT");
        double rejectedBefore = counterValue("replay.records.rejected", "reason", "TRANSACTION_NOT_FOUND");

        String csv = "type,client,tx,amount\n"
            + "dispute,1,1,\n"
            + "deposit,1,1,-5\n"
            + "deposit,1,1,\n"
            + "dispute,1,1,1.0\n"
            + "refund,1,1,1.0\n"
            + "deposit,1,1,5\n"
            + "deposit,1,1,5\n"
            + "dispute,1,1,\n";

        ReplayReport report = replay(csv);

        assertEquals(8, report.getRowsRead());
        assertEquals(2, report.getApplied());
        assertEquals(1, report.rejectionsOf(TransactionErrorKind.TRANSACTION_NOT_FOUND));
        assertEquals(1, report.rejectionsOf(TransactionErrorKind.DUPLICATE_TRANSACTION));
        assertEquals(1, report.malformedOf(ParseErrorKind.NEGATIVE_AMOUNT));
        assertEquals(1, report.malformedOf(ParseErrorKind.MISSING_AMOUNT));
        assertEquals(1, report.malformedOf(ParseErrorKind.SUPERFLUOUS_AMOUNT));
        assertEquals(1, report.malformedOf(ParseErrorKind.UNKNOWN_TYPE));

        ClientAccount account = account(report, 1);
        assertAmount("0", account.getAvailable());
        assertAmount("5", account.getHeld());
        assertAmount("5", account.getTotal());

        assertEquals(malformedBefore + 1, counterValue("replay.rows.malformed", "reason", "SUPERFLUOUS_AMOUNT"));
        assertEquals(rejectedBefore + 1, counterValue("replay.records.rejected", "reason", "TRANSACTION_NOT_FOUND"));
    }

    @Test
    @DisplayName("Amount in exponent notation is skipped and later rows still apply")
    void exponentAmountIsSkipped() throws IOException {
        String csv = "type,client,tx,amount\n"
            + "deposit,1,1,1E+999999999\n"
            + "deposit,1,2,0.1\n";

        ReplayReport report = replay(csv);

        assertEquals(2, report.getRowsRead());
        assertEquals(1, report.getApplied());
        assertEquals(1, report.malformedOf(ParseErrorKind.INVALID_AMOUNT));
        assertAmount("0.1", account(report, 1).getTotal());
    }

    @Test
    @DisplayName("Each replay starts from an empty ledger")
    void replaysAreIndependent() throws IOException {
        String csv = "type,client,tx,amount\ndeposit,1,1,1.0\n";

        ReplayReport first = replay(csv);
        ReplayReport second = replay(csv);

        assertEquals(1, first.getApplied());
        assertEquals(1, second.getApplied());
        assertEquals(0, second.getRejected());
        assertAmount("1", account(second, 1).getTotal());
    }

    @Test
    @DisplayName("Unusable header aborts the replay")
    void badHeaderIsFatal() {
        assertThrows(CsvFormatException.class, () -> replay("kind,client,tx,amount\ndeposit,1,1,1\n"));
    }

    @Test
    @DisplayName("Unterminated quote aborts the replay")
    void brokenQuotingIsFatal() {
        assertThrows(IOException.class, () -> replay("type,client,tx,amount\ndeposit,1,1,\"1.0\n"));
    }

    @Test
    @DisplayName("Final ledger renders as CSV in client order")
    void rendersFinalLedger() throws IOException {
        String csv = "type,client,tx,amount\n"
            + "deposit,3,1,3\n"
            + "withdrawal,2,2,5.0\n"
            + "deposit,1,3,1.25\n";

        ReplayReport report = replay(csv);
        StringWriter out = new StringWriter();
        accountWriter.write(report.getLedger().accounts(), out);

        assertEquals("client,available,held,total,locked\n"
                + "1,1.25,0,1.25,false\n"
                + "2,0,0,0,false\n"
                + "3,3,0,3,false\n",
            out.toString());
    }
}
