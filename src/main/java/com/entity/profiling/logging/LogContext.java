package com.entity.profiling.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close, so
 * contexts nest on one thread.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEntity(runId, entityId)) {
 *     log.info("profile.written entityId={}", entityId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole pipeline run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Creates a log context for the per-entity stage of a run.
     * Worker threads open their own context, since MDC is thread-local.
     */
    public static LogContext forEntity(String runId, String entityId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("entityId", entityId);
        ctx.put("operation", "profile");
        return ctx;
    }

    public static String generateRunId() {
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
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
        previous.clear();
    }
}
