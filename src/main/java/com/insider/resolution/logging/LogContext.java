package com.insider.resolution.logging;

import com.insider.resolution.concurrent.MdcPropagatingExecutor;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and, on close, puts back whatever those keys held before.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, "gale klappa")) {
 *     log.info("identity.resolved outcome={} affiliations={}", outcome, count);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String QUERY = "query";
    public static final String OPERATION = "operation";
    public static final String BATCH_ID = "batchId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a single-name resolution.
     */
    public static LogContext forResolution(String correlationId, String query) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(QUERY, query);
        ctx.put(OPERATION, "resolve");
        return ctx;
    }

    /**
     * Creates a log context for an exhaustive scan worker.
     */
    public static LogContext forScan(String entityId) {
        LogContext ctx = new LogContext();
        ctx.put("entityId", entityId);
        ctx.put(OPERATION, "scan");
        return ctx;
    }

    /**
     * Creates a log context for batch operations.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put(BATCH_ID, batchId);
        ctx.put(OPERATION, "batch");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Wraps an executor so submitted tasks see the submitter's MDC entries.
     */
    public static Executor propagating(Executor executor) {
        return new MdcPropagatingExecutor(executor);
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        });
        previous.clear();
    }
}
