package com.flagship.settlement_ledger.replay;

import com.flagship.settlement_ledger.ledger.ClientLedger;
import com.flagship.settlement_ledger.ledger.TransactionErrorKind;
import com.flagship.settlement_ledger.transaction.ParseErrorKind;
import lombok.Value;

import java.util.Map;

/**
 * Result of one replay: the final ledger and what happened to every row.
 */
@Value
public class ReplayReport {
    ClientLedger ledger;
    long rowsRead;
    long applied;
    Map<TransactionErrorKind, Long> rejections;
    Map<ParseErrorKind, Long> malformedRows;

    public long getRejected() {
        return rejections.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getMalformed() {
        return malformedRows.values().stream().mapToLong(Long::longValue).sum();
    }

    public long rejectionsOf(TransactionErrorKind kind) {
        return rejections.getOrDefault(kind, 0L);
    }

    public long malformedOf(ParseErrorKind kind) {
        return malformedRows.getOrDefault(kind, 0L);
    }
}
