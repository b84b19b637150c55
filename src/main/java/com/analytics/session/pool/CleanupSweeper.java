package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodic eviction of connections idle for at least the TTL.
 */
final class CleanupSweeper<H extends DocumentHandle> {
    private static final Logger log = LoggerFactory.getLogger(CleanupSweeper.class);

    private final ConnectionRegistry<H> registry;
    private final Clock clock;
    private final Duration ttl;
    private final Consumer<PooledConnection<H>> onExpired;
    private volatile ScheduledFuture<?> schedule;

    CleanupSweeper(ConnectionRegistry<H> registry, Clock clock, Duration ttl,
                   Consumer<PooledConnection<H>> onExpired) {
        this.registry = registry;
        this.clock = clock;
        this.ttl = ttl;
        this.onExpired = onExpired;
    }

    void start(ScheduledExecutorService scheduler, Duration interval) {
        long millis = interval.toMillis();
        schedule = scheduler.scheduleAtFixedRate(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
    }

    void stop() {
        ScheduledFuture<?> current = schedule;
        if (current != null) {
            current.cancel(false);
            schedule = null;
        }
    }

    /**
     * Evicts expired idle connections now.
     *
     * @return the number of connections evicted
     */
    int sweep() {
        List<PooledConnection<H>> expired = registry.removeExpired(clock.instant(), ttl);
        for (PooledConnection<H> connection : expired) {
            log.debug("Closing expired connection for {} (idle since {})",
                    connection.resourceId(), connection.lastUsedAt());
            onExpired.accept(connection);
        }
        if (!expired.isEmpty()) {
            log.debug("Cleaned up {} expired connections", expired.size());
        }
        return expired.size();
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the schedule
            log.error("Connection sweep failed", e);
        }
    }
}
