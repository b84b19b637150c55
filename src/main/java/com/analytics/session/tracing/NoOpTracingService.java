package com.analytics.session.tracing;

import java.util.Map;

/**
 * {@link TracingService} that records nothing. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final Span INERT = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return INERT;
    }
}
