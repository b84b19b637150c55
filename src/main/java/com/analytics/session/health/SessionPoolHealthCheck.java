package com.analytics.session.health;

import com.analytics.session.pool.PoolConfig;
import com.analytics.session.pool.PoolStats;
import com.analytics.session.pool.SessionPool;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health check for the session pool.
 *
 * <p>DOWN once the pool is shut down. DEGRADED while any resource holds more connections
 * than the soft per-resource cap, which happens when concurrent misses pile up on one
 * resource. UP otherwise.</p>
 */
public class SessionPoolHealthCheck implements HealthCheck {

    private final SessionPool<?> pool;
    private final int softCap;

    public SessionPoolHealthCheck(SessionPool<?> pool, PoolConfig config) {
        this.pool = pool;
        this.softCap = config.getMaxConnectionsPerResource();
    }

    @Override
    public String getName() {
        return "sessionPool";
    }

    @Override
    public HealthStatus check() {
        if (pool.isShutdown()) {
            return HealthStatus.down("Session pool is shut down");
        }

        PoolStats stats = pool.getStats();
        Map<String, Integer> overCap = stats.connectionsByResource().entrySet().stream()
                .filter(e -> e.getValue() > softCap)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

        HealthStatus base = overCap.isEmpty()
                ? HealthStatus.up()
                : HealthStatus.degraded("Resources over " + softCap + " connections: " + overCap.keySet());

        return base
                .withDetail("totalConnections", stats.totalConnections())
                .withDetail("activeConnections", stats.activeConnections())
                .withDetail("idleConnections", stats.idleConnections())
                .withDetail("totalRequests", stats.totalRequests())
                .withDetail("hitRate", Math.round(stats.hitRate() * 1000.0) / 10.0)
                .withDetail("averageConnectionAgeMs", stats.averageConnectionAge().toMillis());
    }
}
