package com.analytics.session.metrics;

import com.analytics.session.pool.PoolStats;
import com.analytics.session.pool.RemovalReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PoolMetrics Tests")
class PoolMetricsTest {

    @Nested
    @DisplayName("NoOpPoolMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallable() {
            NoOpPoolMetrics noOp = new NoOpPoolMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.recordSessionOpened(Duration.ofMillis(250));
                noOp.recordSessionOpenFailed();
                noOp.recordConnectionRemoved(RemovalReason.EXPIRED);
                noOp.recordTransportFault();
                noOp.recordReconnectAttempt(true);
                noOp.recordHealthProbeFailure();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerPoolMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerPoolMetrics metrics = new MicrometerPoolMetrics(registry);

        @Test
        @DisplayName("Should count hits and misses under one name")
        void requests() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.get("session.pool.requests").tag("result", "hit").counter().count());
            assertEquals(1.0, registry.get("session.pool.requests").tag("result", "miss").counter().count());
        }

        @Test
        @DisplayName("Should time session opens and count failures")
        void opens() {
            metrics.recordSessionOpened(Duration.ofMillis(300));
            metrics.recordSessionOpenFailed();

            assertEquals(1, registry.get("session.pool.open.duration").timer().count());
            assertEquals(300.0, registry.get("session.pool.open.duration").timer().totalTime(TimeUnit.MILLISECONDS), 0.01);
            assertEquals(1.0, registry.get("session.pool.open.failures").counter().count());
        }

        @Test
        @DisplayName("Should tag removals with the lowercase reason")
        void removals() {
            metrics.recordConnectionRemoved(RemovalReason.HEALTH_CHECK_FAILED);
            metrics.recordConnectionRemoved(RemovalReason.EXPIRED);
            metrics.recordConnectionRemoved(RemovalReason.EXPIRED);

            assertEquals(1.0, registry.get("session.pool.removed").tag("reason", "health_check_failed").counter().count());
            assertEquals(2.0, registry.get("session.pool.removed").tag("reason", "expired").counter().count());
        }

        @Test
        @DisplayName("Removal tags should not depend on the default locale")
        void removalTagsIgnoreLocale() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                SimpleMeterRegistry turkish = new SimpleMeterRegistry();
                new MicrometerPoolMetrics(turkish).recordConnectionRemoved(RemovalReason.HEALTH_CHECK_FAILED);

                assertEquals(1.0, turkish.get("session.pool.removed").tag("reason", "health_check_failed").counter().count());
            } finally {
                Locale.setDefault(previous);
            }
        }

        @Test
        @DisplayName("Should count faults, reconnect outcomes and probe failures")
        void faults() {
            metrics.recordTransportFault();
            metrics.recordReconnectAttempt(false);
            metrics.recordReconnectAttempt(true);
            metrics.recordHealthProbeFailure();

            assertEquals(1.0, registry.get("session.pool.transport.faults").counter().count());
            assertEquals(1.0, registry.get("session.pool.reconnect.attempts").tag("outcome", "failure").counter().count());
            assertEquals(1.0, registry.get("session.pool.reconnect.attempts").tag("outcome", "success").counter().count());
            assertEquals(1.0, registry.get("session.pool.health.failures").counter().count());
        }

        @Test
        @DisplayName("Connection gauges should read live pool stats")
        void gauges() {
            AtomicReference<PoolStats> current = new AtomicReference<>(
                    new PoolStats(3, 1, 2, Map.of("app1", 3), Duration.ZERO, 0, 0, 0));
            metrics.bindTo(current::get);

            assertEquals(1.0, registry.get("session.pool.connections").tag("state", "active").gauge().value());
            assertEquals(2.0, registry.get("session.pool.connections").tag("state", "idle").gauge().value());

            current.set(new PoolStats(0, 0, 0, Map.of(), Duration.ZERO, 0, 0, 0));
            assertEquals(0.0, registry.get("session.pool.connections").tag("state", "idle").gauge().value());
        }
    }
}
