package com.analytics.session.tracing;

/**
 * A traced unit of pool work, ended when closed.
 * Being {@link AutoCloseable}, a span opened in try-with-resources ends when the block exits.
 *
 * <pre>
 * try (Span span = tracing.startSpan("session.pool.execute", Map.of("resourceId", id))) {
 *     span.setAttribute("attempt", attempt);
 *     ...
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
