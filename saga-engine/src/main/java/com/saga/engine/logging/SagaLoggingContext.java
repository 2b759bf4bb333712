package com.saga.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs emitted while driving a saga carry its identity.
 *
 * Usage:
 * <pre>
 * try (var ctx = SagaLoggingContext.forSaga(sagaId, sagaType)) {
 *     try (var stepCtx = SagaLoggingContext.forStep(stepName, attempt)) {
 *         log.info("Executing step"); // includes sagaId, sagaType, step, attempt
 *     }
 * }
 * </pre>
 *
 * Contexts nest: closing one restores the keys it overwrote.
 */
public final class SagaLoggingContext implements AutoCloseable {

    public static final String SAGA_ID = "sagaId";
    public static final String SAGA_TYPE = "sagaType";
    public static final String STEP = "step";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private SagaLoggingContext() {
    }

    /**
     * Create a logging context for saga-level operations.
     */
    public static SagaLoggingContext forSaga(String sagaId, String sagaType) {
        SagaLoggingContext ctx = new SagaLoggingContext();
        ctx.put(SAGA_ID, sagaId);
        ctx.put(SAGA_TYPE, sagaType);
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one step attempt, nested inside a saga context.
     */
    public static SagaLoggingContext forStep(String stepName, int attempt) {
        SagaLoggingContext ctx = new SagaLoggingContext();
        ctx.put(STEP, stepName);
        ctx.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    public static String getSagaId() {
        return MDC.get(SAGA_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        previous.put(key, MDC.get(key));
        MDC.put(key, value);
    }

    private void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}
