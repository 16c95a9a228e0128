package com.flagship.treasury_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys carried on every log line of a request or consumed deposit.
 *
 * {@code correlationId} comes from the {@code X-Correlation-ID} header or the
 * deposit notification's event id. {@code transactionId} is set while a
 * ledger row is being written.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private CorrelationContext() {
    }

    /**
     * Binds the given id, or a fresh one when blank, and returns the id in use.
     */
    public static String begin(String correlationId) {
        String id = correlationId == null || correlationId.isBlank() ? newCorrelationId() : correlationId;
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static void enterTransaction(UUID transactionId) {
        MDC.put(TRANSACTION_ID_MDC_KEY, transactionId.toString());
    }

    public static void leaveTransaction() {
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }

    // 8 hex chars are enough to follow one request through the logs
    static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
