package com.lookup.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forLookup("departments", "name")) {
 *     log.info("lookup.completed matchType={} confidence={}", matchType, confidence);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a single lookup.
     */
    public static LogContext forLookup(String datasetId, String sourceColumn) {
        LogContext ctx = new LogContext();
        ctx.put("datasetId", datasetId);
        ctx.put("sourceColumn", sourceColumn);
        ctx.put("operation", "lookup");
        return ctx;
    }

    /**
     * Creates a log context for batch lookups.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Creates a log context for review session operations.
     */
    public static LogContext forReview(String sessionId, String action) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("reviewAction", action);
        ctx.put("operation", "review");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
