package com.analytics.session.cdi;

import com.analytics.session.endpoint.ActiveEndpointProvider;
import com.analytics.session.endpoint.Endpoint;
import com.analytics.session.endpoint.InMemoryEndpointRegistry;
import com.analytics.session.engine.DocumentHandle;
import com.analytics.session.engine.SessionFactory;
import com.analytics.session.health.SessionPoolHealthCheck;
import com.analytics.session.metrics.MicrometerPoolMetrics;
import com.analytics.session.metrics.NoOpPoolMetrics;
import com.analytics.session.pool.PersistentSessionPool;
import com.analytics.session.pool.PoolConfig;
import com.analytics.session.pool.TransportFaultClassifier;
import com.analytics.session.tracing.NoOpTracingService;
import com.analytics.session.tracing.OpenTelemetryTracingService;
import com.analytics.session.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the session pool from MicroProfile Config properties.
 *
 * <p>The application supplies a {@code SessionFactory<DocumentHandle>} bean for its
 * engine client; everything else is produced here. Minimal configuration:</p>
 * <pre>
 * session-pool:
 *   endpoint:
 *     id: main
 *     url: https://tenant.example.com
 *     credential: ${ENGINE_API_KEY}
 * </pre>
 *
 * <p>When a Micrometer {@code MeterRegistry} or an OpenTelemetry {@code Tracer} bean is
 * resolvable the pool reports through it, otherwise metrics and tracing are no-ops.</p>
 */
@ApplicationScoped
public class SessionPoolProducer {

    private static final Logger log = LoggerFactory.getLogger(SessionPoolProducer.class);

    // ── Pool ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "session-pool.connection-ttl-ms", defaultValue = "180000")
    long connectionTtlMs;

    @Inject
    @ConfigProperty(name = "session-pool.health-check-interval-ms", defaultValue = "30000")
    long healthCheckIntervalMs;

    @Inject
    @ConfigProperty(name = "session-pool.cleanup-interval-ms", defaultValue = "60000")
    long cleanupIntervalMs;

    @Inject
    @ConfigProperty(name = "session-pool.max-connections-per-resource", defaultValue = "3")
    int maxConnectionsPerResource;

    @Inject
    @ConfigProperty(name = "session-pool.max-reconnect-attempts", defaultValue = "3")
    int maxReconnectAttempts;

    @Inject
    @ConfigProperty(name = "session-pool.reconnect-backoff-ms", defaultValue = "1000")
    long reconnectBackoffMs;

    @Inject
    @ConfigProperty(name = "session-pool.max-retry-attempts", defaultValue = "3")
    int maxRetryAttempts;

    @Inject
    @ConfigProperty(name = "session-pool.scheduler-threads", defaultValue = "2")
    int schedulerThreads;

    @Inject
    @ConfigProperty(name = "session-pool.shutdown-timeout-ms", defaultValue = "5000")
    long shutdownTimeoutMs;

    @Inject
    @ConfigProperty(name = "session-pool.transport-fault-phrases")
    Optional<List<String>> extraTransportFaultPhrases;

    // ── Endpoint ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "session-pool.endpoint.id", defaultValue = "default")
    String endpointId;

    @Inject
    @ConfigProperty(name = "session-pool.endpoint.name")
    Optional<String> endpointName;

    @Inject
    @ConfigProperty(name = "session-pool.endpoint.url", defaultValue = "https://localhost")
    String endpointUrl;

    @Inject
    @ConfigProperty(name = "session-pool.endpoint.credential")
    Optional<String> endpointCredential;

    // ── Observability ─────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistries;

    @Inject
    Instance<Tracer> tracers;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public PoolConfig poolConfig() {
        return PoolConfig.builder()
                .connectionTtl(Duration.ofMillis(connectionTtlMs))
                .healthCheckInterval(Duration.ofMillis(healthCheckIntervalMs))
                .cleanupInterval(Duration.ofMillis(cleanupIntervalMs))
                .maxConnectionsPerResource(maxConnectionsPerResource)
                .maxReconnectAttempts(maxReconnectAttempts)
                .reconnectBaseDelay(Duration.ofMillis(reconnectBackoffMs))
                .maxRetryAttempts(maxRetryAttempts)
                .schedulerThreads(schedulerThreads)
                .shutdownTimeout(Duration.ofMillis(shutdownTimeoutMs))
                .build();
    }

    @Produces
    @Singleton
    public InMemoryEndpointRegistry endpointRegistry() {
        Endpoint endpoint = new Endpoint(endpointId, endpointName.orElse(endpointId), endpointUrl,
                endpointCredential.orElse(""));
        if (!endpoint.hasCredential()) {
            log.warn("No credential configured for endpoint {}", endpoint.id());
        }
        return new InMemoryEndpointRegistry(endpoint);
    }

    @Produces
    @Singleton
    public PersistentSessionPool<DocumentHandle> sessionPool(SessionFactory<DocumentHandle> sessionFactory,
                                                             ActiveEndpointProvider endpointProvider,
                                                             PoolConfig config) {
        log.info("Producing session pool: endpoint={}", endpointProvider.current());

        PersistentSessionPool.Builder<DocumentHandle> builder = PersistentSessionPool
                .builder(sessionFactory, endpointProvider)
                .config(config)
                .tracing(createTracingService())
                .faultClassifier(createFaultClassifier());

        MicrometerPoolMetrics micrometer = createMicrometerMetrics();
        if (micrometer == null) {
            return builder.metrics(new NoOpPoolMetrics()).build();
        }
        PersistentSessionPool<DocumentHandle> pool = builder.metrics(micrometer).build();
        micrometer.bindTo(pool::getStats);
        return pool;
    }

    public void closeSessionPool(@Disposes PersistentSessionPool<DocumentHandle> pool) {
        log.info("Closing session pool");
        pool.shutdown();
    }

    @Produces
    @Singleton
    public SessionPoolHealthCheck sessionPoolHealthCheck(PersistentSessionPool<DocumentHandle> pool) {
        return new SessionPoolHealthCheck(pool, pool.getConfig());
    }

    // ══════════════════════════════════════════════════════════
    //  Helpers
    // ══════════════════════════════════════════════════════════

    private MicrometerPoolMetrics createMicrometerMetrics() {
        if (meterRegistries == null || !meterRegistries.isResolvable()) {
            log.info("No MeterRegistry available, session pool metrics disabled");
            return null;
        }
        return new MicrometerPoolMetrics(meterRegistries.get());
    }

    TracingService createTracingService() {
        if (tracers == null || !tracers.isResolvable()) {
            return new NoOpTracingService();
        }
        return new OpenTelemetryTracingService(tracers.get());
    }

    TransportFaultClassifier createFaultClassifier() {
        List<String> extra = extraTransportFaultPhrases != null
                ? extraTransportFaultPhrases.orElse(List.of())
                : List.of();
        if (extra.isEmpty()) {
            return new TransportFaultClassifier();
        }
        log.info("Additional transport fault phrases: {}", extra);
        return TransportFaultClassifier.withAdditionalPhrases(extra.toArray(String[]::new));
    }
}
