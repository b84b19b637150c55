package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;

import java.util.Collection;

/**
 * Pool of warm engine sessions keyed by resource id.
 *
 * <p>Consumers either lease a connection with {@link #getConnection(String)} and release
 * it on every exit path, or hand the pool an operation through
 * {@link #executeWithRetry(String, HandleOperation)}, which releases and recovers from
 * transport faults on their behalf.</p>
 */
public interface SessionPool<H extends DocumentHandle> extends AutoCloseable {

    /**
     * Returns an idle, non-expired connection for the resource, or opens a new one.
     * Never waits for a busy connection.
     *
     * @throws IllegalStateException if the pool is shut down
     * @throws RuntimeException      if a new session cannot be opened
     */
    PooledSession<H> getConnection(String resourceId);

    /**
     * Runs the operation on a pooled handle, releasing it afterwards. Transport faults
     * trigger eviction, reconnect and retry up to the configured attempt budget; any
     * other failure propagates unchanged.
     *
     * @throws ReconnectExhaustedException if a transport fault could not be repaired
     */
    <T> T executeWithRetry(String resourceId, HandleOperation<H, T> operation);

    /**
     * Pre-opens one connection per resource id, best effort.
     *
     * @return the number of resource ids that were warmed successfully
     */
    int warmUp(Collection<String> resourceIds);

    PoolStats getStats();

    /**
     * Returns {@code cacheHits / totalRequests}, 0.0 before any request.
     */
    double getHitRate();

    /**
     * Stops all background work and closes every pooled session. Idempotent.
     */
    void shutdown();

    boolean isShutdown();

    @Override
    default void close() {
        shutdown();
    }
}
