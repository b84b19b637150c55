package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;
import com.analytics.session.metrics.PoolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Bounded exponential-backoff reconnect.
 *
 * <p>Attempt {@code n} sleeps {@code baseDelay * 2^(n-1)} and then opens and registers a
 * connection. The loop gives up after {@code maxReconnectAttempts}, or early when the
 * pool is shutting down or the thread is interrupted.</p>
 */
final class Reconnector<H extends DocumentHandle> {
    private static final Logger log = LoggerFactory.getLogger(Reconnector.class);

    @FunctionalInterface
    interface Connector<H extends DocumentHandle> {
        PooledConnection<H> connect(String resourceId);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final PoolConfig config;
    private final Connector<H> connector;
    private final BooleanSupplier cancelled;
    private final PoolMetrics metrics;
    private final Sleeper sleeper;

    Reconnector(PoolConfig config, Connector<H> connector, BooleanSupplier cancelled, PoolMetrics metrics) {
        this(config, connector, cancelled, metrics, d -> Thread.sleep(d.toMillis()));
    }

    Reconnector(PoolConfig config, Connector<H> connector, BooleanSupplier cancelled,
                PoolMetrics metrics, Sleeper sleeper) {
        this.config = config;
        this.connector = connector;
        this.cancelled = cancelled;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    ReconnectOutcome<H> reconnect(String resourceId) {
        int maxAttempts = config.getMaxReconnectAttempts();
        Throwable lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration backoff = config.backoffFor(attempt);
            log.debug("Reconnecting to {}, attempt {}/{} (backoff: {}ms)",
                    resourceId, attempt, maxAttempts, backoff.toMillis());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Reconnect to {} interrupted after {} attempts", resourceId, attempt - 1);
                return new ReconnectOutcome.Exhausted<>(resourceId, attempt - 1, lastError);
            }
            if (cancelled.getAsBoolean()) {
                log.debug("Reconnect to {} cancelled, pool is shutting down", resourceId);
                return new ReconnectOutcome.Exhausted<>(resourceId, attempt - 1, lastError);
            }

            try {
                PooledConnection<H> connection = connector.connect(resourceId);
                metrics.recordReconnectAttempt(true);
                log.info("Reconnected to {} on attempt {}", resourceId, attempt);
                return new ReconnectOutcome.Connected<>(connection, attempt);
            } catch (RuntimeException e) {
                lastError = e;
                metrics.recordReconnectAttempt(false);
                log.warn("Reconnect to {} failed on attempt {}/{}: {}",
                        resourceId, attempt, maxAttempts, e.getMessage());
            }
        }

        log.warn("Max reconnect attempts ({}) reached for {}", maxAttempts, resourceId);
        return new ReconnectOutcome.Exhausted<>(resourceId, maxAttempts, lastError);
    }
}
