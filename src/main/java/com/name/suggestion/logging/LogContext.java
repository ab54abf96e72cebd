package com.name.suggestion.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSuggestion(correlationId, "MEMBER_NOT_FOUND")) {
 *     log.info("suggestion.done unknown={} count={}", unknown, count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a suggestion lookup.
     */
    public static LogContext forSuggestion(String correlationId, String category) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("category", category);
        ctx.put("operation", "suggest");
        return ctx;
    }

    /**
     * Creates a log context for loading a candidate pool.
     */
    public static LogContext forPoolLoad(String correlationId, String poolKey) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("poolKey", poolKey);
        ctx.put("operation", "loadPool");
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
