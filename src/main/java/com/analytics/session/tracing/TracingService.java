package com.analytics.session.tracing;

import java.util.Map;

/**
 * Tracing seam for pool operations. {@link NoOpTracingService} is used unless an
 * OpenTelemetry {@code Tracer} is supplied.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
