package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A caller's lease on a pooled connection.
 *
 * <p>Release exactly once on every exit path, most simply with try-with-resources:</p>
 * <pre>
 * try (PooledSession&lt;MyDoc&gt; lease = pool.getConnection("app-1")) {
 *     lease.handle().evaluate("Sum(Sales)");
 * }
 * </pre>
 *
 * <p>Calls after the first release are ignored.</p>
 */
public final class PooledSession<H extends DocumentHandle> implements AutoCloseable {

    private final PooledConnection<H> connection;
    private final Runnable releaseAction;
    private final boolean reused;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PooledSession(PooledConnection<H> connection, boolean reused, Runnable releaseAction) {
        this.connection = connection;
        this.reused = reused;
        this.releaseAction = releaseAction;
    }

    public H handle() {
        return connection.handle();
    }

    public String resourceId() {
        return connection.resourceId();
    }

    /**
     * True when this lease was served by an existing connection (cache hit).
     */
    public boolean isReused() {
        return reused;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            releaseAction.run();
        }
    }

    @Override
    public void close() {
        release();
    }

    PooledConnection<H> connection() {
        return connection;
    }
}
