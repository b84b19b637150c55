package com.analytics.session.health;

import com.analytics.session.pool.PoolConfig;
import com.analytics.session.pool.PoolStats;
import com.analytics.session.pool.SessionPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories should set status and message")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("OK", HealthStatus.up().message());
            assertTrue(HealthStatus.degraded("slow").isDegraded());
            assertTrue(HealthStatus.down("gone").isDown());
            assertEquals("gone", HealthStatus.down("gone").message());
        }

        @Test
        @DisplayName("withDetail() should return a copy with the detail added")
        void withDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus detailed = base.withDetail("totalConnections", 4);

            assertEquals(4, detailed.details().get("totalConnections"));
            assertTrue(base.details().isEmpty());
        }

        @Test
        @DisplayName("Statuses should order UP < DEGRADED < DOWN")
        void ordering() {
            assertTrue(HealthStatus.down("x").isWorseThan(HealthStatus.degraded("y")));
            assertTrue(HealthStatus.degraded("x").isWorseThan(HealthStatus.up()));
            assertFalse(HealthStatus.up().isWorseThan(HealthStatus.up()));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry should be UP")
        void empty() {
            HealthStatus status = new HealthCheckRegistry().checkAll();

            assertTrue(status.isUp());
            assertEquals("No health checks registered", status.message());
        }

        @Test
        @DisplayName("Should report the worst status with its check name")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("engine", HealthStatus.up()));
            registry.register(check("sessionPool", HealthStatus.degraded("over cap")));
            registry.register(null);

            HealthStatus status = registry.checkAll();

            assertEquals(2, registry.size());
            assertTrue(status.isDegraded());
            assertEquals("sessionPool: over cap", status.message());
            assertTrue(status.details().containsKey("engine"));
            assertTrue(status.details().containsKey("sessionPool"));
        }

        @Test
        @DisplayName("A throwing check should count as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("engine", HealthStatus.up()));
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertEquals("broken: Health check threw: boom", status.message());
        }

        private HealthCheck check(String name, HealthStatus result) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return result;
                }
            };
        }
    }

    @Nested
    @DisplayName("SessionPoolHealthCheck")
    class SessionPoolHealthCheckTests {

        private final PoolConfig config = PoolConfig.builder().maxConnectionsPerResource(2).build();

        private PoolStats stats(Map<String, Integer> byResource) {
            int total = byResource.values().stream().mapToInt(Integer::intValue).sum();
            return new PoolStats(total, 1, total - 1, byResource, Duration.ofSeconds(12), 8, 6, 2);
        }

        @Test
        @DisplayName("Should be UP with stats as details")
        void up() {
            SessionPool<?> pool = mock(SessionPool.class);
            when(pool.getStats()).thenReturn(stats(Map.of("app1", 2, "app2", 1)));

            HealthStatus status = new SessionPoolHealthCheck(pool, config).check();

            assertTrue(status.isUp());
            assertEquals(3, status.details().get("totalConnections"));
            assertEquals(1, status.details().get("activeConnections"));
            assertEquals(2, status.details().get("idleConnections"));
            assertEquals(8L, status.details().get("totalRequests"));
            assertEquals(75.0, status.details().get("hitRate"));
            assertEquals(12_000L, status.details().get("averageConnectionAgeMs"));
        }

        @Test
        @DisplayName("Should be DEGRADED when a resource exceeds the soft cap")
        void degraded() {
            SessionPool<?> pool = mock(SessionPool.class);
            when(pool.getStats()).thenReturn(stats(Map.of("app1", 3)));

            HealthStatus status = new SessionPoolHealthCheck(pool, config).check();

            assertTrue(status.isDegraded());
            assertTrue(status.message().contains("app1"));
        }

        @Test
        @DisplayName("Should be DOWN after shutdown")
        void down() {
            SessionPool<?> pool = mock(SessionPool.class);
            when(pool.isShutdown()).thenReturn(true);

            SessionPoolHealthCheck check = new SessionPoolHealthCheck(pool, config);

            assertEquals("sessionPool", check.getName());
            assertTrue(check.check().isDown());
            verify(pool, never()).getStats();
        }
    }
}
