package com.analytics.session.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("session.pool.execute", Map.of("resourceId", "app1"))) {
                    span.setAttribute("attempts", 2L);
                    span.setStatus(Span.SpanStatus.ERROR);
                    span.recordException(new IllegalStateException("Socket closed"));
                }
            });
        }

        @Test
        @DisplayName("Should return the same inert span")
        void sameSpan() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertSame(noOp.startSpan("a"), noOp.startSpan("b"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private final Tracer tracer = mock(Tracer.class);
        private final SpanBuilder builder = mock(SpanBuilder.class);
        private final io.opentelemetry.api.trace.Span otelSpan = mock(io.opentelemetry.api.trace.Span.class);

        private Span start(String name, Map<String, String> attributes) {
            when(tracer.spanBuilder(name)).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            return new OpenTelemetryTracingService(tracer).startSpan(name, attributes);
        }

        @Test
        @DisplayName("Should start a span with the operation name and attributes")
        void startsSpan() {
            start("session.pool.open", Map.of("resourceId", "app1", "endpoint", "main"));

            verify(tracer).spanBuilder("session.pool.open");
            verify(builder).setAttribute("resourceId", "app1");
            verify(builder).setAttribute("endpoint", "main");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Should map status, attributes and exceptions onto the delegate")
        void delegates() {
            Span span = start("session.pool.execute", Map.of());
            RuntimeException error = new IllegalStateException("Socket closed");

            span.setAttribute("attempts", 3L);
            span.setAttribute("outcome", "failed");
            span.recordException(error);
            span.setStatus(Span.SpanStatus.ERROR);
            span.close();

            verify(otelSpan).setAttribute("attempts", 3L);
            verify(otelSpan).setAttribute("outcome", "failed");
            verify(otelSpan).recordException(error);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("OK status should map to StatusCode.OK")
        void okStatus() {
            Span span = start("session.pool.open", null);

            span.setStatus(Span.SpanStatus.OK);

            verify(otelSpan).setStatus(StatusCode.OK);
        }
    }
}
