package com.analytics.session.metrics;

import com.analytics.session.pool.PoolStats;
import com.analytics.session.pool.RemovalReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link PoolMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code session.pool.requests} - Counter (tag: result=hit|miss)</li>
 *   <li>{@code session.pool.open.duration} - Timer</li>
 *   <li>{@code session.pool.open.failures} - Counter</li>
 *   <li>{@code session.pool.removed} - Counter (tag: reason)</li>
 *   <li>{@code session.pool.transport.faults} - Counter</li>
 *   <li>{@code session.pool.reconnect.attempts} - Counter (tag: outcome=success|failure)</li>
 *   <li>{@code session.pool.health.failures} - Counter</li>
 *   <li>{@code session.pool.connections} - Gauge (tag: state=active|idle), see {@link #bindTo(Supplier)}</li>
 * </ul>
 */
public class MicrometerPoolMetrics implements PoolMetrics {

    private final MeterRegistry registry;
    private final Counter hitCounter;
    private final Counter missCounter;
    private final Timer openTimer;
    private final Counter openFailureCounter;
    private final Map<RemovalReason, Counter> removedCounters = new EnumMap<>(RemovalReason.class);
    private final Counter transportFaultCounter;
    private final Counter reconnectSuccessCounter;
    private final Counter reconnectFailureCounter;
    private final Counter healthFailureCounter;

    public MicrometerPoolMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.hitCounter = requests("hit");
        this.missCounter = requests("miss");
        this.openTimer = Timer.builder("session.pool.open.duration")
                .description("Time to open a session and derive its document handle")
                .register(registry);
        this.openFailureCounter = Counter.builder("session.pool.open.failures")
                .description("Number of failed session opens")
                .register(registry);
        for (RemovalReason reason : RemovalReason.values()) {
            removedCounters.put(reason, Counter.builder("session.pool.removed")
                    .description("Number of connections removed from the pool")
                    .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.transportFaultCounter = Counter.builder("session.pool.transport.faults")
                .description("Number of operations failed by a transport fault")
                .register(registry);
        this.reconnectSuccessCounter = reconnects("success");
        this.reconnectFailureCounter = reconnects("failure");
        this.healthFailureCounter = Counter.builder("session.pool.health.failures")
                .description("Number of failed liveness probes")
                .register(registry);
    }

    /**
     * Registers active/idle connection gauges reading from the given stats source.
     * The gauges hold the supplier strongly, so a method reference is safe to pass.
     */
    public MicrometerPoolMetrics bindTo(Supplier<PoolStats> stats) {
        Gauge.builder("session.pool.connections", stats, s -> s.get().activeConnections())
                .description("Pooled connections by state")
                .tag("state", "active")
                .strongReference(true)
                .register(registry);
        Gauge.builder("session.pool.connections", stats, s -> s.get().idleConnections())
                .description("Pooled connections by state")
                .tag("state", "idle")
                .strongReference(true)
                .register(registry);
        return this;
    }

    @Override
    public void recordCacheHit() {
        hitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        missCounter.increment();
    }

    @Override
    public void recordSessionOpened(Duration openDuration) {
        openTimer.record(openDuration);
    }

    @Override
    public void recordSessionOpenFailed() {
        openFailureCounter.increment();
    }

    @Override
    public void recordConnectionRemoved(RemovalReason reason) {
        removedCounters.get(reason).increment();
    }

    @Override
    public void recordTransportFault() {
        transportFaultCounter.increment();
    }

    @Override
    public void recordReconnectAttempt(boolean succeeded) {
        (succeeded ? reconnectSuccessCounter : reconnectFailureCounter).increment();
    }

    @Override
    public void recordHealthProbeFailure() {
        healthFailureCounter.increment();
    }

    private Counter requests(String result) {
        return Counter.builder("session.pool.requests")
                .description("Connection requests served by the pool")
                .tag("result", result)
                .register(registry);
    }

    private Counter reconnects(String outcome) {
        return Counter.builder("session.pool.reconnect.attempts")
                .description("Reconnect attempts after a connection failure")
                .tag("outcome", outcome)
                .register(registry);
    }
}
