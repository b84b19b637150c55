package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;

/**
 * Result of a bounded reconnect: either a fresh pooled connection or exhaustion.
 */
public sealed interface ReconnectOutcome<H extends DocumentHandle>
        permits ReconnectOutcome.Connected, ReconnectOutcome.Exhausted {

    /**
     * A new connection was opened and registered idle.
     *
     * @param connection the registered connection
     * @param attempt    the 1-based attempt that succeeded
     */
    record Connected<H extends DocumentHandle>(PooledConnection<H> connection, int attempt)
            implements ReconnectOutcome<H> {
    }

    /**
     * No connection was produced.
     *
     * @param resourceId the resource that could not be reconnected
     * @param attempts   attempts actually made
     * @param lastError  failure of the last attempt, null if none was made
     */
    record Exhausted<H extends DocumentHandle>(String resourceId, int attempts, Throwable lastError)
            implements ReconnectOutcome<H> {
    }

    default boolean isConnected() {
        return this instanceof Connected;
    }
}
