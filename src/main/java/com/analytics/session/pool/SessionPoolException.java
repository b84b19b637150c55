package com.analytics.session.pool;

/**
 * Base runtime exception for failures raised by the session pool itself.
 */
public class SessionPoolException extends RuntimeException {

    public SessionPoolException(String message) {
        super(message);
    }

    public SessionPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
