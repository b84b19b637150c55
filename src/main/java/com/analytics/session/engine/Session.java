package com.analytics.session.engine;

/**
 * Authenticated bidirectional transport to the remote engine for one resource.
 *
 * @param <H> the document handle type derived from this session
 */
public interface Session<H extends DocumentHandle> extends AutoCloseable {

    /**
     * Derives the document handle callers operate on.
     */
    H openDocument();

    /**
     * Resumes a suspended session in place.
     */
    void resume();

    /**
     * Closes the underlying transport.
     */
    @Override
    void close();
}
