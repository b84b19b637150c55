package com.analytics.session.metrics;

import com.analytics.session.pool.RemovalReason;

import java.time.Duration;

/**
 * Records session pool activity.
 * The default {@link NoOpPoolMetrics} does nothing, so the pool runs without any
 * metrics library on the classpath.
 */
public interface PoolMetrics {

    void recordCacheHit();

    void recordCacheMiss();

    void recordSessionOpened(Duration openDuration);

    void recordSessionOpenFailed();

    void recordConnectionRemoved(RemovalReason reason);

    void recordTransportFault();

    void recordReconnectAttempt(boolean succeeded);

    void recordHealthProbeFailure();
}
