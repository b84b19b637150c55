package com.analytics.session.engine;

/**
 * Stateful proxy for one open analytic document on the remote engine.
 *
 * <p>Business operations live on concrete handle types. The pool itself only
 * needs a liveness signal.</p>
 */
public interface DocumentHandle {

    /**
     * Performs a cheap, idempotent, read-only round trip against the engine
     * (for example fetching the document's current metadata).
     *
     * @throws RuntimeException if the engine cannot be reached or rejects the call
     */
    void probe();
}
