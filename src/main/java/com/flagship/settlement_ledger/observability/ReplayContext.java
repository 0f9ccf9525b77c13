package com.flagship.settlement_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for replay logging.
 *
 * The run id stays in the MDC for a whole replay; row, transaction and client
 * are set while one row is handled, so every diagnostic line can be traced back
 * to its input row.
 */
public final class ReplayContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String ROW_MDC_KEY = "row";
    public static final String TRANSACTION_ID_MDC_KEY = "tx";
    public static final String CLIENT_ID_MDC_KEY = "client";

    private ReplayContext() {
        // Utility class
    }

    /**
     * Starts a run and returns its id.
     */
    public static String beginRun() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_MDC_KEY, runId);
        return runId;
    }

    public static void endRun() {
        clearRow();
        MDC.remove(RUN_ID_MDC_KEY);
    }

    public static void beginRow(long rowNumber, int clientId, long transactionId) {
        MDC.put(ROW_MDC_KEY, String.valueOf(rowNumber));
        MDC.put(CLIENT_ID_MDC_KEY, String.valueOf(clientId));
        MDC.put(TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
    }

    public static void clearRow() {
        MDC.remove(ROW_MDC_KEY);
        MDC.remove(CLIENT_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }
}
