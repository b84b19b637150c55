package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pool membership: resource id to connections in insertion order.
 *
 * <p>All methods synchronize on the registry. Connection state methods called from here
 * synchronize on the connection, so the lock order is always registry, then connection.
 * Lists that become empty are pruned. Once {@link #drain()} has run the registry refuses
 * new members.</p>
 */
final class ConnectionRegistry<H extends DocumentHandle> {

    private final Map<String, List<PooledConnection<H>>> connections = new LinkedHashMap<>();
    private boolean drained;

    /**
     * Acquires the first idle, non-expired connection for the resource.
     *
     * @return the acquired connection, or null on a miss
     */
    synchronized PooledConnection<H> acquireIdle(String resourceId, Instant now, Duration ttl) {
        List<PooledConnection<H>> list = connections.get(resourceId);
        if (list == null) {
            return null;
        }
        for (PooledConnection<H> connection : list) {
            if (connection.tryAcquire(now, ttl)) {
                return connection;
            }
        }
        return null;
    }

    /**
     * Adds a connection.
     *
     * @return the number of connections now pooled for its resource, or -1 if drained
     */
    synchronized int add(PooledConnection<H> connection) {
        if (drained) {
            return -1;
        }
        List<PooledConnection<H>> list =
                connections.computeIfAbsent(connection.resourceId(), k -> new ArrayList<>());
        list.add(connection);
        return list.size();
    }

    synchronized boolean remove(PooledConnection<H> connection) {
        List<PooledConnection<H>> list = connections.get(connection.resourceId());
        if (list == null) {
            return false;
        }
        boolean removed = list.remove(connection);
        if (list.isEmpty()) {
            connections.remove(connection.resourceId());
        }
        return removed;
    }

    /**
     * Removes every connection of the resource, marking each removed.
     *
     * @return the connections this call removed
     */
    synchronized List<PooledConnection<H>> removeAll(String resourceId) {
        List<PooledConnection<H>> list = connections.remove(resourceId);
        List<PooledConnection<H>> removed = new ArrayList<>();
        if (list != null) {
            for (PooledConnection<H> connection : list) {
                if (connection.markRemoved()) {
                    removed.add(connection);
                }
            }
        }
        return removed;
    }

    /**
     * Removes idle connections whose idle age reached the TTL, marking each removed.
     */
    synchronized List<PooledConnection<H>> removeExpired(Instant now, Duration ttl) {
        List<PooledConnection<H>> expired = new ArrayList<>();
        Iterator<Map.Entry<String, List<PooledConnection<H>>>> entries = connections.entrySet().iterator();
        while (entries.hasNext()) {
            List<PooledConnection<H>> list = entries.next().getValue();
            Iterator<PooledConnection<H>> it = list.iterator();
            while (it.hasNext()) {
                PooledConnection<H> connection = it.next();
                if (connection.isExpired(now, ttl) && connection.markRemoved()) {
                    it.remove();
                    expired.add(connection);
                }
            }
            if (list.isEmpty()) {
                entries.remove();
            }
        }
        return expired;
    }

    /**
     * Empties the registry for good, marking every connection removed.
     */
    synchronized List<PooledConnection<H>> drain() {
        drained = true;
        List<PooledConnection<H>> all = new ArrayList<>();
        for (List<PooledConnection<H>> list : connections.values()) {
            for (PooledConnection<H> connection : list) {
                if (connection.markRemoved()) {
                    all.add(connection);
                }
            }
        }
        connections.clear();
        return all;
    }

    synchronized List<PooledConnection<H>> snapshot() {
        List<PooledConnection<H>> all = new ArrayList<>();
        connections.values().forEach(all::addAll);
        return all;
    }

    synchronized int count(String resourceId) {
        List<PooledConnection<H>> list = connections.get(resourceId);
        return list == null ? 0 : list.size();
    }

    synchronized int resourceCount() {
        return connections.size();
    }
}
