package com.analytics.session.engine;

/**
 * Write side of a session's lifecycle event channel.
 */
@FunctionalInterface
public interface SessionEventSink {

    void publish(SessionEvent event);
}
