package com.analytics.session.endpoint;

/**
 * Synchronous lookup of the currently selected endpoint.
 * The selection may change at runtime; callers must not cache the result.
 */
@FunctionalInterface
public interface ActiveEndpointProvider {

    Endpoint current();
}
