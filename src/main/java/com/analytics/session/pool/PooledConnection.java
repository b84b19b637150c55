package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;
import com.analytics.session.engine.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * One pooled session, its document handle and bookkeeping.
 *
 * <p>State transitions are synchronized on the connection. {@link State#REMOVED} is
 * terminal: once reached, acquire/release/probe transitions are refused.</p>
 */
public final class PooledConnection<H extends DocumentHandle> {
    private static final Logger log = LoggerFactory.getLogger(PooledConnection.class);

    public enum State { IDLE, IN_USE, PROBING, REMOVED }

    private final Session<H> session;
    private final H handle;
    private final String resourceId;
    private final String endpointId;
    private final Instant createdAt;

    private Instant lastUsedAt;
    private State state;
    private ScheduledFuture<?> healthTimer;

    PooledConnection(Session<H> session, H handle, String resourceId, String endpointId,
                     Instant createdAt, State initialState) {
        if (initialState != State.IDLE && initialState != State.IN_USE) {
            throw new IllegalArgumentException("Connections start IDLE or IN_USE, not " + initialState);
        }
        this.session = session;
        this.handle = handle;
        this.resourceId = resourceId;
        this.endpointId = endpointId;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
        this.state = initialState;
    }

    public Session<H> session() { return session; }
    public H handle() { return handle; }
    public String resourceId() { return resourceId; }
    public String endpointId() { return endpointId; }
    public Instant createdAt() { return createdAt; }

    public synchronized Instant lastUsedAt() {
        return lastUsedAt;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean isRemoved() {
        return state == State.REMOVED;
    }

    /**
     * True when idle for at least {@code ttl}. An idle age equal to the TTL counts as expired.
     */
    synchronized boolean isExpired(Instant now, Duration ttl) {
        return state == State.IDLE && Duration.between(lastUsedAt, now).compareTo(ttl) >= 0;
    }

    /**
     * Moves IDLE to IN_USE if the connection is still within its TTL.
     */
    synchronized boolean tryAcquire(Instant now, Duration ttl) {
        if (state != State.IDLE || Duration.between(lastUsedAt, now).compareTo(ttl) >= 0) {
            return false;
        }
        state = State.IN_USE;
        lastUsedAt = now;
        return true;
    }

    /**
     * Moves IN_USE back to IDLE and stamps the release time.
     *
     * @return false if the connection was not in use (already released or removed)
     */
    synchronized boolean release(Instant now) {
        if (state != State.IN_USE) {
            return false;
        }
        state = State.IDLE;
        lastUsedAt = now;
        return true;
    }

    /**
     * Takes a probe lease on an idle connection so no caller acquires it mid-probe.
     */
    synchronized boolean beginProbe() {
        if (state != State.IDLE) {
            return false;
        }
        state = State.PROBING;
        return true;
    }

    /**
     * Returns a probed connection to IDLE without touching {@code lastUsedAt}.
     */
    synchronized void endProbe() {
        if (state == State.PROBING) {
            state = State.IDLE;
        }
    }

    /**
     * Marks the connection removed and cancels its health timer.
     *
     * @return true only for the call that performed the transition
     */
    boolean markRemoved() {
        ScheduledFuture<?> timer;
        synchronized (this) {
            if (state == State.REMOVED) {
                return false;
            }
            state = State.REMOVED;
            timer = healthTimer;
            healthTimer = null;
        }
        if (timer != null) {
            timer.cancel(false);
        }
        return true;
    }

    /**
     * Installs the health timer. A timer installed after removal is cancelled at once.
     */
    void attachHealthTimer(ScheduledFuture<?> timer) {
        boolean removed;
        synchronized (this) {
            removed = state == State.REMOVED;
            if (!removed) {
                healthTimer = timer;
            }
        }
        if (removed) {
            timer.cancel(false);
        }
    }

    synchronized boolean hasHealthTimer() {
        return healthTimer != null;
    }

    /**
     * Closes the session, logging instead of propagating failures.
     */
    void closeQuietly() {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Error closing session for {}: {}", resourceId, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "PooledConnection{" +
                "resourceId='" + resourceId + '\'' +
                ", endpointId='" + endpointId + '\'' +
                ", state=" + state() +
                ", createdAt=" + createdAt +
                '}';
    }
}
