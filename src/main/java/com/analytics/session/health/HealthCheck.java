package com.analytics.session.health;

/**
 * A named check of one component's current health.
 * Implementations inspect a single component (the session pool, the engine endpoint)
 * and return a {@link HealthStatus} describing its current state.
 */
public interface HealthCheck {

    /**
     * Returns the name this check is reported under.
     */
    String getName();

    /**
     * Runs the check and returns the component's current status.
     */
    HealthStatus check();
}
