package com.analytics.session.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for pool work. Entries are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResource(resourceId, "execute")) {
 *     log.debug("session.acquired");
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String RESOURCE_ID = "resourceId";
    public static final String OPERATION = "operation";
    public static final String CORRELATION_ID = "correlationId";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a caller-facing operation on one resource; carries a fresh correlation id.
     */
    public static LogContext forResource(String resourceId, String operation) {
        return new LogContext()
                .with(RESOURCE_ID, resourceId)
                .with(OPERATION, operation)
                .with(CORRELATION_ID, UUID.randomUUID().toString());
    }

    /**
     * Context for background pool work (probe, sweep, repair) on one resource.
     */
    public static LogContext forBackground(String resourceId, String task) {
        return new LogContext()
                .with(RESOURCE_ID, resourceId)
                .with(OPERATION, task);
    }

    public LogContext with(String key, String value) {
        if (value != null) {
            keys.add(key);
            MDC.put(key, value);
        }
        return this;
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
