package com.analytics.session.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Event channel between a {@link SessionFactory} and the consumer of one session's
 * lifecycle events.
 *
 * <p>A session may report events while its handshake is still in flight, before the
 * consumer knows which pooled entry the session belongs to. Events published before
 * {@link #attach(Consumer)} are buffered and replayed in publication order on attach;
 * afterwards they are delivered directly on the publishing thread.</p>
 */
public class SessionEventChannel implements SessionEventSink {

    private final Deque<SessionEvent> pending = new ArrayDeque<>();
    private Consumer<SessionEvent> consumer;

    @Override
    public void publish(SessionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        Consumer<SessionEvent> target;
        synchronized (this) {
            if (consumer == null) {
                pending.addLast(event);
                return;
            }
            target = consumer;
        }
        target.accept(event);
    }

    /**
     * Attaches the consumer and replays buffered events to it.
     *
     * @throws IllegalStateException if a consumer is already attached
     */
    public void attach(Consumer<SessionEvent> eventConsumer) {
        Objects.requireNonNull(eventConsumer, "eventConsumer must not be null");
        while (true) {
            SessionEvent next;
            synchronized (this) {
                if (consumer != null) {
                    throw new IllegalStateException("Event consumer already attached");
                }
                next = pending.pollFirst();
                if (next == null) {
                    consumer = eventConsumer;
                    return;
                }
            }
            eventConsumer.accept(next);
        }
    }

    /**
     * Returns the number of events waiting for a consumer.
     */
    public synchronized int pendingCount() {
        return pending.size();
    }
}
