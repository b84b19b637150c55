package com.analytics.session.metrics;

import com.analytics.session.pool.RemovalReason;

import java.time.Duration;

/**
 * No-op {@link PoolMetrics}.
 */
public class NoOpPoolMetrics implements PoolMetrics {

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordSessionOpened(Duration openDuration) {
    }

    @Override
    public void recordSessionOpenFailed() {
    }

    @Override
    public void recordConnectionRemoved(RemovalReason reason) {
    }

    @Override
    public void recordTransportFault() {
    }

    @Override
    public void recordReconnectAttempt(boolean succeeded) {
    }

    @Override
    public void recordHealthProbeFailure() {
    }
}
