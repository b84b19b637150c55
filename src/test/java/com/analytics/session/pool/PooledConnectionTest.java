package com.analytics.session.pool;

import com.analytics.session.endpoint.Endpoint;
import com.analytics.session.engine.Session;
import com.analytics.session.engine.SessionEventChannel;
import com.analytics.session.pool.FakeSessionFactory.FakeDocument;
import com.analytics.session.pool.FakeSessionFactory.FakeSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PooledConnection Tests")
class PooledConnectionTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(3);

    private final FakeSession session = new FakeSession("app1",
            new Endpoint("main", "Main", "https://main.example.com", ""), new SessionEventChannel());

    private PooledConnection<FakeDocument> connection(PooledConnection.State state) {
        return new PooledConnection<>(session, session.document(), "app1", "main", T0, state);
    }

    @Test
    @DisplayName("Should start with lastUsedAt equal to createdAt")
    void initialTimestamps() {
        PooledConnection<FakeDocument> connection = connection(PooledConnection.State.IN_USE);

        assertEquals(T0, connection.createdAt());
        assertEquals(T0, connection.lastUsedAt());
        assertEquals("main", connection.endpointId());
    }

    @Test
    @DisplayName("Should only start IDLE or IN_USE")
    void rejectsOtherInitialStates() {
        assertThrows(IllegalArgumentException.class, () -> connection(PooledConnection.State.PROBING));
        assertThrows(IllegalArgumentException.class, () -> connection(PooledConnection.State.REMOVED));
    }

    @Test
    @DisplayName("Acquire and release should stamp lastUsedAt")
    void acquireRelease() {
        PooledConnection<FakeDocument> connection = connection(PooledConnection.State.IDLE);
        Instant acquiredAt = T0.plusSeconds(30);
        Instant releasedAt = T0.plusSeconds(90);

        assertTrue(connection.tryAcquire(acquiredAt, TTL));
        assertFalse(connection.tryAcquire(acquiredAt, TTL), "In-use connection must not be shared");
        assertTrue(connection.release(releasedAt));
        assertFalse(connection.release(releasedAt), "Second release must be ignored");

        assertEquals(PooledConnection.State.IDLE, connection.state());
        assertEquals(releasedAt, connection.lastUsedAt());
    }

    @Test
    @DisplayName("Acquire should refuse a connection whose idle age reached the TTL")
    void acquireRefusesExpired() {
        PooledConnection<FakeDocument> connection = connection(PooledConnection.State.IDLE);

        assertTrue(connection.isExpired(T0.plus(TTL), TTL));
        assertFalse(connection.tryAcquire(T0.plus(TTL), TTL));
        assertFalse(connection.isExpired(T0.plus(TTL).minusMillis(1), TTL));
    }

    @Test
    @DisplayName("In-use connection should never count as expired")
    void inUseNeverExpired() {
        assertFalse(connection(PooledConnection.State.IN_USE).isExpired(T0.plus(TTL.multipliedBy(10)), TTL));
    }

    @Test
    @DisplayName("Probe lease should block acquisition and leave lastUsedAt untouched")
    void probeLease() {
        PooledConnection<FakeDocument> connection = connection(PooledConnection.State.IDLE);

        assertTrue(connection.beginProbe());
        assertEquals(PooledConnection.State.PROBING, connection.state());
        assertFalse(connection.tryAcquire(T0.plusSeconds(1), TTL));
        assertFalse(connection.beginProbe());
        connection.endProbe();

        assertEquals(PooledConnection.State.IDLE, connection.state());
        assertEquals(T0, connection.lastUsedAt());
    }

    @Test
    @DisplayName("Removal should happen once, cancel the timer and be terminal")
    void removal() {
        PooledConnection<FakeDocument> connection = connection(PooledConnection.State.IN_USE);
        ScheduledFuture<?> timer = mock(ScheduledFuture.class);
        connection.attachHealthTimer(timer);

        assertTrue(connection.markRemoved());
        assertFalse(connection.markRemoved());

        verify(timer, times(1)).cancel(false);
        assertTrue(connection.isRemoved());
        assertFalse(connection.release(T0.plusSeconds(1)));
        assertFalse(connection.beginProbe());
        assertFalse(connection.tryAcquire(T0.plusSeconds(1), TTL));
    }

    @Test
    @DisplayName("closeQuietly should swallow close failures")
    void closeQuietly() {
        @SuppressWarnings("unchecked")
        Session<FakeDocument> failing = mock(Session.class);
        doThrow(new IllegalStateException("already closed")).when(failing).close();
        PooledConnection<FakeDocument> connection = new PooledConnection<>(failing, session.document(),
                "app1", "main", T0, PooledConnection.State.IDLE);

        assertDoesNotThrow(connection::closeQuietly);
        verify(failing).close();
    }
}
