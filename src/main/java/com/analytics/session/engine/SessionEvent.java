package com.analytics.session.engine;

import java.util.Objects;

/**
 * Lifecycle notification emitted by a session's transport.
 *
 * @param type       what happened
 * @param resourceId the resource the session serves
 * @param cause      the transport error for {@link Type#ERROR}, otherwise usually null
 */
public record SessionEvent(Type type, String resourceId, Throwable cause) {

    public enum Type { CLOSED, SUSPENDED, ERROR }

    public SessionEvent {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static SessionEvent closed(String resourceId) {
        return new SessionEvent(Type.CLOSED, resourceId, null);
    }

    public static SessionEvent suspended(String resourceId) {
        return new SessionEvent(Type.SUSPENDED, resourceId, null);
    }

    public static SessionEvent error(String resourceId, Throwable cause) {
        return new SessionEvent(Type.ERROR, resourceId, cause);
    }
}
