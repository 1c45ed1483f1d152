package com.entity.integration.logging;

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
 * try (LogContext ctx = LogContext.forDocument(batchId, documentId)) {
 *     log.info("document.integrated entities={}", count);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for integrating one document.
     */
    public static LogContext forDocument(String batchId, String documentId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("documentId", documentId);
        ctx.put("operation", "integrate");
        return ctx;
    }

    /**
     * Creates a log context for a batch run over many files.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Creates a log context for writing an export.
     */
    public static LogContext forExport(String format) {
        LogContext ctx = new LogContext();
        ctx.put("exportFormat", format);
        ctx.put("operation", "export");
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
