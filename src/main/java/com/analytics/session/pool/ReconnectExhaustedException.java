package com.analytics.session.pool;

/**
 * Thrown by {@link SessionPool#executeWithRetry} when a transport fault could not be
 * repaired within the configured number of reconnect attempts.
 * The transport fault that triggered the reconnect is the cause.
 */
public class ReconnectExhaustedException extends SessionPoolException {

    private final String resourceId;
    private final int attempts;

    public ReconnectExhaustedException(String resourceId, int attempts, Throwable cause) {
        super("Failed to reconnect to " + resourceId + " after " + attempts + " attempts", cause);
        this.resourceId = resourceId;
        this.attempts = attempts;
    }

    public String getResourceId() {
        return resourceId;
    }

    public int getAttempts() {
        return attempts;
    }
}
