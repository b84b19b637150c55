package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;
import com.analytics.session.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-connection liveness probing on a fixed delay.
 *
 * <p>Only idle connections are probed. The probe holds a transient lease so no caller
 * can acquire the handle mid-probe; connections held by a caller are skipped for that
 * tick. A failed probe is reported to the {@link FailureListener} before the lease is
 * dropped, so the connection is removed without ever returning to IDLE.</p>
 */
final class HealthMonitor<H extends DocumentHandle> {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    enum ProbeResult { HEALTHY, FAILED, SKIPPED }

    @FunctionalInterface
    interface FailureListener<H extends DocumentHandle> {
        void onProbeFailure(PooledConnection<H> connection, RuntimeException error);
    }

    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final FailureListener<H> listener;

    HealthMonitor(ScheduledExecutorService scheduler, Duration interval, FailureListener<H> listener) {
        this.scheduler = scheduler;
        this.interval = interval;
        this.listener = listener;
    }

    /**
     * Starts probing the connection. The timer is owned by the connection and cancelled
     * when it is removed.
     */
    void watch(PooledConnection<H> connection) {
        long millis = interval.toMillis();
        try {
            ScheduledFuture<?> timer = scheduler.scheduleWithFixedDelay(
                    () -> probe(connection), millis, millis, TimeUnit.MILLISECONDS);
            connection.attachHealthTimer(timer);
        } catch (RejectedExecutionException e) {
            log.debug("Health check not scheduled for {}, scheduler is shut down", connection.resourceId());
        }
    }

    ProbeResult probe(PooledConnection<H> connection) {
        if (!connection.beginProbe()) {
            return ProbeResult.SKIPPED;
        }
        try (LogContext ctx = LogContext.forBackground(connection.resourceId(), "health-probe")) {
            try {
                connection.handle().probe();
                connection.endProbe();
                return ProbeResult.HEALTHY;
            } catch (RuntimeException e) {
                log.warn("Health check failed for {}, removing and reconnecting: {}",
                        connection.resourceId(), e.getMessage());
                // still PROBING here, so no caller can acquire the failed connection
                try {
                    listener.onProbeFailure(connection, e);
                } catch (RuntimeException listenerError) {
                    log.error("Probe failure handling failed for {}", connection.resourceId(), listenerError);
                } finally {
                    connection.endProbe();
                }
                return ProbeResult.FAILED;
            }
        }
    }
}
