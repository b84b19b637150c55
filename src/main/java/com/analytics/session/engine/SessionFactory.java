package com.analytics.session.engine;

import com.analytics.session.endpoint.Endpoint;

/**
 * Opens authenticated sessions against the remote engine.
 *
 * <p>Implementations perform the authentication handshake and protocol negotiation,
 * and report transport lifecycle changes by publishing {@link SessionEvent}s into
 * the supplied sink for as long as the session lives.</p>
 *
 * @param <H> the document handle type produced by sessions of this factory
 */
@FunctionalInterface
public interface SessionFactory<H extends DocumentHandle> {

    /**
     * Opens a session for the given resource.
     *
     * @param resourceId the logical resource (document) identifier
     * @param endpoint   the endpoint and credential selected at call time
     * @param events     sink receiving lifecycle events of the new session
     * @return an open session
     * @throws RuntimeException if the handshake fails
     */
    Session<H> open(String resourceId, Endpoint endpoint, SessionEventSink events);
}
