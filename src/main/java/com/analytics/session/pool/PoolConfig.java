package com.analytics.session.pool;

import java.time.Duration;

/**
 * Configuration for {@link PersistentSessionPool}.
 */
public class PoolConfig {

    private final Duration connectionTtl;
    private final Duration healthCheckInterval;
    private final Duration cleanupInterval;
    private final int maxConnectionsPerResource;
    private final int maxReconnectAttempts;
    private final Duration reconnectBaseDelay;
    private final int maxRetryAttempts;
    private final int schedulerThreads;
    private final Duration shutdownTimeout;

    private PoolConfig(Builder builder) {
        this.connectionTtl = builder.connectionTtl;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.cleanupInterval = builder.cleanupInterval;
        this.maxConnectionsPerResource = builder.maxConnectionsPerResource;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.reconnectBaseDelay = builder.reconnectBaseDelay;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.schedulerThreads = builder.schedulerThreads;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    /** Maximum idle time before a connection is considered stale. */
    public Duration getConnectionTtl() { return connectionTtl; }
    public Duration getHealthCheckInterval() { return healthCheckInterval; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    /** Soft cap: exceeding it is reported, never enforced. */
    public int getMaxConnectionsPerResource() { return maxConnectionsPerResource; }
    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public Duration getReconnectBaseDelay() { return reconnectBaseDelay; }
    public int getMaxRetryAttempts() { return maxRetryAttempts; }
    public int getSchedulerThreads() { return schedulerThreads; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }

    /**
     * Backoff before reconnect attempt {@code attempt} (1-based): {@code base * 2^(attempt-1)}.
     */
    public Duration backoffFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        return reconnectBaseDelay.multipliedBy(1L << Math.min(attempt - 1, 30));
    }

    public static PoolConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration connectionTtl = Duration.ofMinutes(3);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration cleanupInterval = Duration.ofMinutes(1);
        private int maxConnectionsPerResource = 3;
        private int maxReconnectAttempts = 3;
        private Duration reconnectBaseDelay = Duration.ofSeconds(1);
        private int maxRetryAttempts = 3;
        private int schedulerThreads = 2;
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder connectionTtl(Duration connectionTtl) {
            this.connectionTtl = requirePositive(connectionTtl, "connectionTtl");
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = requirePositive(healthCheckInterval, "healthCheckInterval");
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = requirePositive(cleanupInterval, "cleanupInterval");
            return this;
        }

        public Builder maxConnectionsPerResource(int maxConnectionsPerResource) {
            if (maxConnectionsPerResource <= 0) throw new IllegalArgumentException("maxConnectionsPerResource must be > 0");
            this.maxConnectionsPerResource = maxConnectionsPerResource;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            if (maxReconnectAttempts <= 0) throw new IllegalArgumentException("maxReconnectAttempts must be > 0");
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder reconnectBaseDelay(Duration reconnectBaseDelay) {
            if (reconnectBaseDelay == null || reconnectBaseDelay.isNegative()) {
                throw new IllegalArgumentException("reconnectBaseDelay must be >= 0");
            }
            this.reconnectBaseDelay = reconnectBaseDelay;
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            if (maxRetryAttempts <= 0) throw new IllegalArgumentException("maxRetryAttempts must be > 0");
            this.maxRetryAttempts = maxRetryAttempts;
            return this;
        }

        public Builder schedulerThreads(int schedulerThreads) {
            if (schedulerThreads <= 0) throw new IllegalArgumentException("schedulerThreads must be > 0");
            this.schedulerThreads = schedulerThreads;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = requirePositive(shutdownTimeout, "shutdownTimeout");
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "connectionTtl=" + connectionTtl +
                ", healthCheckInterval=" + healthCheckInterval +
                ", cleanupInterval=" + cleanupInterval +
                ", maxConnectionsPerResource=" + maxConnectionsPerResource +
                ", maxReconnectAttempts=" + maxReconnectAttempts +
                ", reconnectBaseDelay=" + reconnectBaseDelay +
                ", maxRetryAttempts=" + maxRetryAttempts +
                ", schedulerThreads=" + schedulerThreads +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }
}
