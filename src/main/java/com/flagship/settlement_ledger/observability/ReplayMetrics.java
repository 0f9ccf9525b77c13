package com.flagship.settlement_ledger.observability;

import com.flagship.settlement_ledger.ledger.TransactionErrorKind;
import com.flagship.settlement_ledger.transaction.ParseErrorKind;
import com.flagship.settlement_ledger.transaction.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Replay metrics.
 *
 * Metrics exposed:
 * - replay.records.applied: records applied, tagged by type
 * - replay.records.rejected: records rejected by the ledger, tagged by type and reason
 * - replay.rows.malformed: rows that could not be parsed, tagged by reason
 * - replay.runs: completed replays
 * - replay.duration: time taken by a whole replay
 */
@Component
public class ReplayMetrics {

    private final MeterRegistry registry;

    private final Counter runs;
    private final Timer replayTimer;

    public ReplayMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.runs = Counter.builder("replay.runs")
                .description("Number of completed replays")
                .register(registry);

        this.replayTimer = Timer.builder("replay.duration")
                .description("Time taken to replay one input")
                .register(registry);
    }

    public void recordApplied(TransactionType type) {
        registry.counter("replay.records.applied", "type", type.getValue()).increment();
    }

    public void recordRejected(TransactionType type, TransactionErrorKind reason) {
        registry.counter("replay.records.rejected",
                "type", type.getValue(),
                "reason", reason.name()
        ).increment();
    }

    public void recordMalformed(ParseErrorKind reason) {
        registry.counter("replay.rows.malformed", "reason", reason.name()).increment();
    }

    public void recordRun(Duration duration) {
        runs.increment();
        replayTimer.record(duration);
    }
}
