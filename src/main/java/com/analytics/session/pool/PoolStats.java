package com.analytics.session.pool;

import java.time.Duration;
import java.util.Map;

/**
 * Point-in-time statistics for a {@link SessionPool}.
 *
 * @param totalConnections      pooled connections (active + idle)
 * @param activeConnections     connections currently held by callers
 * @param idleConnections       connections available for reuse (includes those being probed)
 * @param connectionsByResource pooled connection count per resource id
 * @param averageConnectionAge  mean time since creation over pooled connections
 * @param totalRequests         connection requests since pool creation
 * @param cacheHits             requests served by an existing connection
 * @param cacheMisses           requests that opened a new connection
 */
public record PoolStats(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        Map<String, Integer> connectionsByResource,
        Duration averageConnectionAge,
        long totalRequests,
        long cacheHits,
        long cacheMisses
) {

    public PoolStats {
        connectionsByResource = connectionsByResource != null ? Map.copyOf(connectionsByResource) : Map.of();
        averageConnectionAge = averageConnectionAge != null ? averageConnectionAge : Duration.ZERO;
    }

    /**
     * Returns {@code cacheHits / totalRequests} (0.0 to 1.0), or 0.0 before any request.
     */
    public double hitRate() {
        return totalRequests == 0 ? 0.0 : (double) cacheHits / totalRequests;
    }
}
