package com.analytics.session.pool;

import com.analytics.session.endpoint.ActiveEndpointProvider;
import com.analytics.session.endpoint.Endpoint;
import com.analytics.session.engine.DocumentHandle;
import com.analytics.session.engine.Session;
import com.analytics.session.engine.SessionEventChannel;
import com.analytics.session.engine.SessionFactory;
import com.analytics.session.logging.LogContext;
import com.analytics.session.metrics.NoOpPoolMetrics;
import com.analytics.session.metrics.PoolMetrics;
import com.analytics.session.tracing.NoOpTracingService;
import com.analytics.session.tracing.Span;
import com.analytics.session.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session pool that keeps engine sessions warm per resource id.
 *
 * <p>Opening a session costs an authentication handshake plus protocol negotiation, so
 * connections are reused across requests for the same resource until they sit idle for
 * the configured TTL. Alongside the caller-facing operations the pool runs:</p>
 * <ul>
 *   <li>a {@link CleanupSweeper} evicting idle-expired connections,</li>
 *   <li>a {@link HealthMonitor} probing each idle connection and repairing broken ones
 *       through a detached, tracked reconnect,</li>
 *   <li>a {@link SessionLifecycleHandler} deregistering sessions the remote side closed.</li>
 * </ul>
 *
 * <p>A cache miss always opens a new connection; callers never wait for a busy one. The
 * per-resource connection limit is a soft cap that is logged and reported by
 * {@code SessionPoolHealthCheck} but not enforced.</p>
 *
 * <p>The endpoint is looked up from the {@link ActiveEndpointProvider} each time a
 * session is opened, so an endpoint switch affects new connections only.</p>
 *
 * @param <H> the document handle type
 */
public class PersistentSessionPool<H extends DocumentHandle> implements SessionPool<H> {
    private static final Logger log = LoggerFactory.getLogger(PersistentSessionPool.class);

    private final SessionFactory<H> sessionFactory;
    private final ActiveEndpointProvider endpointProvider;
    private final PoolConfig config;
    private final Clock clock;
    private final PoolMetrics metrics;
    private final TracingService tracing;
    private final TransportFaultClassifier faultClassifier;

    private final ConnectionRegistry<H> registry = new ConnectionRegistry<>();
    private final ScheduledThreadPoolExecutor scheduler;
    private final ExecutorService workers;
    private final Set<Future<?>> repairTasks = ConcurrentHashMap.newKeySet();
    private final HealthMonitor<H> healthMonitor;
    private final CleanupSweeper<H> sweeper;
    private final Reconnector<H> reconnector;
    private final SessionLifecycleHandler<H> lifecycleHandler;

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private PersistentSessionPool(Builder<H> builder) {
        this.sessionFactory = builder.sessionFactory;
        this.endpointProvider = builder.endpointProvider;
        this.config = builder.config;
        this.clock = builder.clock;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.faultClassifier = builder.faultClassifier;

        this.scheduler = new ScheduledThreadPoolExecutor(config.getSchedulerThreads(),
                daemonThreads("session-pool-scheduler"));
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.workers = Executors.newCachedThreadPool(daemonThreads("session-pool-worker"));

        this.lifecycleHandler = new SessionLifecycleHandler<>(this::deregister);
        this.healthMonitor = new HealthMonitor<>(scheduler, config.getHealthCheckInterval(), this::onProbeFailure);
        this.reconnector = new Reconnector<>(config, id -> openConnection(id, PooledConnection.State.IDLE),
                closed::get, metrics);
        this.sweeper = new CleanupSweeper<>(registry, clock, config.getConnectionTtl(), connection -> {
            metrics.recordConnectionRemoved(RemovalReason.EXPIRED);
            connection.closeQuietly();
        });
        this.sweeper.start(scheduler, config.getCleanupInterval());

        log.info("Session pool initialized: {}", config);
    }

    public static <H extends DocumentHandle> Builder<H> builder(SessionFactory<H> sessionFactory,
                                                                ActiveEndpointProvider endpointProvider) {
        return new Builder<>(sessionFactory, endpointProvider);
    }

    // ========== Caller-facing operations ==========

    @Override
    public PooledSession<H> getConnection(String resourceId) {
        requireResourceId(resourceId);
        requireOpen();
        totalRequests.incrementAndGet();

        PooledConnection<H> idle = registry.acquireIdle(resourceId, clock.instant(), config.getConnectionTtl());
        if (idle != null) {
            cacheHits.incrementAndGet();
            metrics.recordCacheHit();
            log.debug("Reusing connection for {}", resourceId);
            return lease(idle, true);
        }

        cacheMisses.incrementAndGet();
        metrics.recordCacheMiss();
        log.debug("Creating new connection for {}...", resourceId);
        return lease(openConnection(resourceId, PooledConnection.State.IN_USE), false);
    }

    @Override
    public <T> T executeWithRetry(String resourceId, HandleOperation<H, T> operation) {
        requireResourceId(resourceId);
        Objects.requireNonNull(operation, "operation must not be null");
        int maxAttempts = config.getMaxRetryAttempts();

        try (LogContext ctx = LogContext.forResource(resourceId, "execute");
             Span span = tracing.startSpan("session.pool.execute", Map.of("resourceId", resourceId))) {
            for (int attempt = 1; ; attempt++) {
                span.setAttribute("attempts", attempt);
                try (PooledSession<H> lease = getConnection(resourceId)) {
                    T result = operation.apply(lease.handle());
                    span.setStatus(Span.SpanStatus.OK);
                    return result;
                } catch (RuntimeException e) {
                    if (!faultClassifier.isTransportFault(e) || attempt >= maxAttempts) {
                        span.recordException(e);
                        span.setStatus(Span.SpanStatus.ERROR);
                        throw e;
                    }

                    metrics.recordTransportFault();
                    log.warn("Operation failed for {} (attempt {}/{}): {}",
                            resourceId, attempt, maxAttempts, e.getMessage());
                    evictAll(resourceId);

                    ReconnectOutcome<H> outcome = reconnector.reconnect(resourceId);
                    if (outcome instanceof ReconnectOutcome.Exhausted<H> exhausted) {
                        ReconnectExhaustedException failure =
                                new ReconnectExhaustedException(resourceId, exhausted.attempts(), e);
                        span.recordException(failure);
                        span.setStatus(Span.SpanStatus.ERROR);
                        throw failure;
                    }
                }
            }
        }
    }

    @Override
    public int warmUp(Collection<String> resourceIds) {
        if (resourceIds == null || resourceIds.isEmpty()) {
            return 0;
        }
        if (closed.get()) {
            log.warn("Warm-up skipped, session pool is shut down");
            return 0;
        }
        log.info("Warming up {} resources...", resourceIds.size());

        List<Future<Boolean>> results = new ArrayList<>(resourceIds.size());
        for (String resourceId : resourceIds) {
            try {
                results.add(workers.submit(() -> warmOne(resourceId)));
            } catch (RejectedExecutionException e) {
                log.debug("Warm-up of {} not started, pool is shutting down", resourceId);
            }
        }

        int successful = 0;
        for (Future<Boolean> result : results) {
            try {
                if (result.get()) {
                    successful++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for warm-up");
                break;
            } catch (ExecutionException | CancellationException e) {
                log.debug("Warm-up task did not complete: {}", e.getMessage());
            }
        }

        log.info("Warm-up complete: {}/{} resources ready", successful, resourceIds.size());
        return successful;
    }

    private boolean warmOne(String resourceId) {
        try (PooledSession<H> lease = getConnection(resourceId)) {
            log.debug("Warmed {} ({})", resourceId, lease.isReused() ? "reused" : "opened");
            return true;
        } catch (RuntimeException e) {
            log.warn("Warm-up failed for {}: {}", resourceId, e.getMessage());
            return false;
        }
    }

    @Override
    public PoolStats getStats() {
        Instant now = clock.instant();
        int active = 0;
        int idle = 0;
        Duration totalAge = Duration.ZERO;
        Map<String, Integer> byResource = new LinkedHashMap<>();

        for (PooledConnection<H> connection : registry.snapshot()) {
            PooledConnection.State state = connection.state();
            if (state == PooledConnection.State.REMOVED) {
                continue;
            }
            byResource.merge(connection.resourceId(), 1, Integer::sum);
            if (state == PooledConnection.State.IN_USE) {
                active++;
            } else {
                idle++;
            }
            totalAge = totalAge.plus(Duration.between(connection.createdAt(), now));
        }

        int total = active + idle;
        return new PoolStats(
                total,
                active,
                idle,
                byResource,
                total > 0 ? totalAge.dividedBy(total) : Duration.ZERO,
                totalRequests.get(),
                cacheHits.get(),
                cacheMisses.get()
        );
    }

    @Override
    public double getHitRate() {
        long requests = totalRequests.get();
        return requests == 0 ? 0.0 : (double) cacheHits.get() / requests;
    }

    /**
     * Evicts idle-expired connections immediately instead of waiting for the next sweep.
     *
     * @return the number of connections evicted
     */
    public int evictExpired() {
        return sweeper.sweep();
    }

    public PoolConfig getConfig() {
        return config;
    }

    @Override
    public boolean isShutdown() {
        return closed.get();
    }

    @Override
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down session pool...");

        sweeper.stop();
        repairTasks.forEach(task -> task.cancel(true));
        scheduler.shutdownNow();
        for (Runnable pending : workers.shutdownNow()) {
            if (pending instanceof Future<?> future) {
                future.cancel(false);
            }
        }

        List<PooledConnection<H>> connections = registry.drain();
        for (PooledConnection<H> connection : connections) {
            metrics.recordConnectionRemoved(RemovalReason.SHUTDOWN);
            connection.closeQuietly();
        }

        awaitTermination(scheduler, "scheduler");
        awaitTermination(workers, "worker");
        log.info("Session pool shut down, closed {} connections", connections.size());
    }

    // ========== Connection lifecycle ==========

    /**
     * Opens a session through the factory and registers it. The endpoint is resolved now,
     * not at pool construction.
     */
    private PooledConnection<H> openConnection(String resourceId, PooledConnection.State initialState) {
        Endpoint endpoint = endpointProvider.current();
        SessionEventChannel events = new SessionEventChannel();
        long startNanos = System.nanoTime();
        log.debug("Opening session to {} for {}", endpoint.displayName(), resourceId);

        PooledConnection<H> connection;
        try (Span span = tracing.startSpan("session.pool.open",
                Map.of("resourceId", resourceId, "endpoint", endpoint.id()))) {
            Session<H> session;
            try {
                session = sessionFactory.open(resourceId, endpoint, events);
            } catch (RuntimeException e) {
                recordOpenFailure(span, e);
                throw e;
            }

            H handle;
            try {
                handle = session.openDocument();
            } catch (RuntimeException e) {
                recordOpenFailure(span, e);
                closeQuietly(session, resourceId);
                throw e;
            }

            connection = new PooledConnection<>(session, handle, resourceId, endpoint.id(),
                    clock.instant(), initialState);
            Duration openDuration = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordSessionOpened(openDuration);
            span.setStatus(Span.SpanStatus.OK);
            log.debug("New connection created for {} ({}ms)", resourceId, openDuration.toMillis());
        }

        register(connection, events);
        return connection;
    }

    private void register(PooledConnection<H> connection, SessionEventChannel events) {
        int count = registry.add(connection);
        if (count < 0) {
            connection.markRemoved();
            connection.closeQuietly();
            throw new IllegalStateException("Session pool is closed");
        }
        if (count > config.getMaxConnectionsPerResource()) {
            log.warn("{} now has {} pooled connections (soft cap {})",
                    connection.resourceId(), count, config.getMaxConnectionsPerResource());
        }
        events.attach(event -> lifecycleHandler.handle(connection, event));
        healthMonitor.watch(connection);
    }

    private PooledSession<H> lease(PooledConnection<H> connection, boolean reused) {
        return new PooledSession<>(connection, reused, () -> releaseConnection(connection));
    }

    private void releaseConnection(PooledConnection<H> connection) {
        if (connection.release(clock.instant())) {
            log.debug("Connection released for {}", connection.resourceId());
        } else {
            log.debug("Release ignored for {} connection of {}", connection.state(), connection.resourceId());
        }
    }

    /**
     * Removes a connection from the pool. Only the first removal of a connection has any
     * effect.
     */
    boolean deregister(PooledConnection<H> connection, RemovalReason reason, boolean closeSession) {
        if (!connection.markRemoved()) {
            return false;
        }
        registry.remove(connection);
        metrics.recordConnectionRemoved(reason);
        if (closeSession) {
            connection.closeQuietly();
        }
        log.debug("Connection removed for {} ({})", connection.resourceId(), reason);
        return true;
    }

    private void evictAll(String resourceId) {
        List<PooledConnection<H>> evicted = registry.removeAll(resourceId);
        for (PooledConnection<H> connection : evicted) {
            metrics.recordConnectionRemoved(RemovalReason.TRANSPORT_FAULT);
            connection.closeQuietly();
        }
        log.debug("Evicted {} connections for {}", evicted.size(), resourceId);
    }

    private void onProbeFailure(PooledConnection<H> connection, RuntimeException error) {
        metrics.recordHealthProbeFailure();
        if (deregister(connection, RemovalReason.HEALTH_CHECK_FAILED, true)) {
            spawnRepair(connection.resourceId());
        }
    }

    /**
     * Starts a detached reconnect for the resource. The task is tracked so shutdown can
     * cancel it; its outcome is only logged.
     */
    private void spawnRepair(String resourceId) {
        if (closed.get()) {
            return;
        }
        FutureTask<Void> task = new FutureTask<>(() -> repair(resourceId), null) {
            @Override
            protected void done() {
                repairTasks.remove(this);
            }
        };
        repairTasks.add(task);
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            repairTasks.remove(task);
            log.debug("Repair of {} not started, pool is shutting down", resourceId);
        }
    }

    private void repair(String resourceId) {
        try (LogContext ctx = LogContext.forBackground(resourceId, "repair")) {
            ReconnectOutcome<H> outcome = reconnector.reconnect(resourceId);
            if (outcome instanceof ReconnectOutcome.Connected<H> connected) {
                log.info("Background reconnect succeeded for {} on attempt {}", resourceId, connected.attempt());
            } else {
                log.warn("Background reconnect failed for {}", resourceId);
            }
        } catch (RuntimeException e) {
            log.warn("Background reconnect failed for {}: {}", resourceId, e.getMessage());
        }
    }

    int pendingRepairCount() {
        return repairTasks.size();
    }

    // ========== Helpers ==========

    private void requireOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Session pool is closed");
        }
    }

    private static void requireResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be null or blank");
        }
    }

    private void recordOpenFailure(Span span, RuntimeException e) {
        metrics.recordSessionOpenFailed();
        span.recordException(e);
        span.setStatus(Span.SpanStatus.ERROR);
    }

    private static void closeQuietly(Session<?> session, String resourceId) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Error closing session for {}: {}", resourceId, e.getMessage());
        }
    }

    private void awaitTermination(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Session pool {} threads did not stop within {}", name, config.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Builder for {@link PersistentSessionPool}. Only the session factory and endpoint
     * provider are required.
     */
    public static final class Builder<H extends DocumentHandle> {
        private final SessionFactory<H> sessionFactory;
        private final ActiveEndpointProvider endpointProvider;
        private PoolConfig config = PoolConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private PoolMetrics metrics = new NoOpPoolMetrics();
        private TracingService tracing = new NoOpTracingService();
        private TransportFaultClassifier faultClassifier = new TransportFaultClassifier();

        private Builder(SessionFactory<H> sessionFactory, ActiveEndpointProvider endpointProvider) {
            this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory must not be null");
            this.endpointProvider = Objects.requireNonNull(endpointProvider, "endpointProvider must not be null");
        }

        public Builder<H> config(PoolConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder<H> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder<H> metrics(PoolMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
            return this;
        }

        public Builder<H> tracing(TracingService tracing) {
            this.tracing = Objects.requireNonNull(tracing, "tracing must not be null");
            return this;
        }

        public Builder<H> faultClassifier(TransportFaultClassifier faultClassifier) {
            this.faultClassifier = Objects.requireNonNull(faultClassifier, "faultClassifier must not be null");
            return this;
        }

        public PersistentSessionPool<H> build() {
            return new PersistentSessionPool<>(this);
        }
    }
}
