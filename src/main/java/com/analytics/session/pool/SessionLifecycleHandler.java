package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;
import com.analytics.session.engine.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes a pooled session's lifecycle events.
 *
 * <ul>
 *   <li>CLOSED: deregister the connection</li>
 *   <li>ERROR: deregister and close the session</li>
 *   <li>SUSPENDED: resume in place; deregister as for ERROR if resuming fails</li>
 * </ul>
 */
final class SessionLifecycleHandler<H extends DocumentHandle> {
    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleHandler.class);

    @FunctionalInterface
    interface Deregistration<H extends DocumentHandle> {
        boolean deregister(PooledConnection<H> connection, RemovalReason reason, boolean closeSession);
    }

    private final Deregistration<H> deregistration;

    SessionLifecycleHandler(Deregistration<H> deregistration) {
        this.deregistration = deregistration;
    }

    void handle(PooledConnection<H> connection, SessionEvent event) {
        switch (event.type()) {
            case CLOSED -> {
                log.debug("Session closed for {}", connection.resourceId());
                deregistration.deregister(connection, RemovalReason.SESSION_CLOSED, false);
            }
            case ERROR -> {
                log.debug("Session error for {}: {}", connection.resourceId(),
                        event.cause() != null ? event.cause().getMessage() : "unknown");
                deregistration.deregister(connection, RemovalReason.SESSION_ERROR, true);
            }
            case SUSPENDED -> resume(connection);
        }
    }

    private void resume(PooledConnection<H> connection) {
        if (connection.isRemoved()) {
            return;
        }
        log.debug("Session suspended for {}, attempting resume...", connection.resourceId());
        try {
            connection.session().resume();
        } catch (RuntimeException e) {
            log.warn("Resume failed for {}: {}", connection.resourceId(), e.getMessage());
            deregistration.deregister(connection, RemovalReason.SESSION_ERROR, true);
        }
    }
}
