package com.analytics.session.pool;

/**
 * Why a connection left the pool.
 */
public enum RemovalReason {
    /** Idle for at least the configured TTL. */
    EXPIRED,
    /** The remote side closed the session. */
    SESSION_CLOSED,
    /** The session reported a transport error, or could not be resumed. */
    SESSION_ERROR,
    /** A liveness probe failed. */
    HEALTH_CHECK_FAILED,
    /** Evicted by a caller after a transport fault. */
    TRANSPORT_FAULT,
    /** The pool was shut down. */
    SHUTDOWN
}
