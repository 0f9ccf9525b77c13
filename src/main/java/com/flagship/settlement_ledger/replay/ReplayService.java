package com.flagship.settlement_ledger.replay;

import com.flagship.settlement_ledger.ledger.ApplyResult;
import com.flagship.settlement_ledger.ledger.LedgerState;
import com.flagship.settlement_ledger.ledger.TransactionEngine;
import com.flagship.settlement_ledger.ledger.TransactionError;
import com.flagship.settlement_ledger.ledger.TransactionErrorKind;
import com.flagship.settlement_ledger.observability.ReplayContext;
import com.flagship.settlement_ledger.observability.ReplayMetrics;
import com.flagship.settlement_ledger.transaction.ParseErrorKind;
import com.flagship.settlement_ledger.transaction.RecordParseException;
import com.flagship.settlement_ledger.transaction.TransactionCsvReader;
import com.flagship.settlement_ledger.transaction.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Replays a transaction CSV into a fresh ledger.
 *
 * Rows are applied strictly in file order. A row that cannot be parsed, or that
 * the engine rejects, is logged as a warning and skipped; the replay always
 * carries on with the next row. Only a failure of the input stream itself
 * aborts the replay.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplayService {

    private final TransactionCsvReader csvReader;
    private final TransactionEngine engine;
    private final ReplayMetrics metrics;

    /**
     * Replays {@code input} from the first row to the last.
     *
     * @param input transaction CSV, header included
     * @return final ledger and per-row statistics
     * @throws IOException if the input cannot be read or is not a transaction CSV
     */
    public ReplayReport replay(Reader input) throws IOException {
        long startTime = System.currentTimeMillis();
        String runId = ReplayContext.beginRun();
        log.info("Starting replay: runId={}", runId);

        try {
            LedgerState state = new LedgerState();
            Tally tally = new Tally(state);

            long rowsRead = csvReader.read(input, tally);

            Duration duration = Duration.ofMillis(System.currentTimeMillis() - startTime);
            metrics.recordRun(duration);

            ReplayReport report = new ReplayReport(
                state.getLedger(),
                rowsRead,
                tally.applied,
                Collections.unmodifiableMap(tally.rejections),
                Collections.unmodifiableMap(tally.malformed)
            );
            log.info("Replay finished: rows={}, applied={}, rejected={}, malformed={}, clients={}, duration={}ms",
                    report.getRowsRead(), report.getApplied(), report.getRejected(), report.getMalformed(),
                    state.getLedger().size(), duration.toMillis());
            return report;

        } catch (IOException e) {
            log.error("Replay aborted: error={}", e.getMessage());
            throw e;
        } finally {
            ReplayContext.endRun();
        }
    }

    /**
     * Feeds parsed rows to the engine and counts the outcomes.
     */
    private final class Tally implements TransactionCsvReader.RowHandler {

        private final LedgerState state;
        private final Map<TransactionErrorKind, Long> rejections = new EnumMap<>(TransactionErrorKind.class);
        private final Map<ParseErrorKind, Long> malformed = new EnumMap<>(ParseErrorKind.class);
        private long applied;

        private Tally(LedgerState state) {
            this.state = state;
        }

        @Override
        public void onRecord(long rowNumber, TransactionRecord record) {
            ReplayContext.beginRow(rowNumber, record.getClientId(), record.getTransactionId());
            try {
                ApplyResult result = engine.apply(state, record);
                if (result.isApplied()) {
                    applied++;
                    metrics.recordApplied(record.getType());
                    log.debug("Applied {} for client {}, tx {}",
                            record.getType().getValue(), record.getClientId(), record.getTransactionId());
                } else {
                    TransactionError error = result.getError().orElseThrow();
                    rejections.merge(error.getKind(), 1L, Long::sum);
                    metrics.recordRejected(record.getType(), error.getKind());
                    log.warn("Row {} rejected: {} {}", rowNumber, error.getKind(), error.getMessage());
                }
            } finally {
                ReplayContext.clearRow();
            }
        }

        @Override
        public void onMalformed(long rowNumber, RecordParseException error) {
            malformed.merge(error.getKind(), 1L, Long::sum);
            metrics.recordMalformed(error.getKind());
            log.warn("Row {} skipped: {} {}", rowNumber, error.getKind(), error.getMessage());
        }
    }
}
