package com.analytics.session.endpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory registry of known endpoints with a switchable active selection.
 *
 * <p>Switching the active endpoint only affects sessions opened afterwards;
 * sessions that are already pooled keep talking to the endpoint they were opened
 * against until they are evicted.</p>
 */
public class InMemoryEndpointRegistry implements ActiveEndpointProvider {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEndpointRegistry.class);

    private final Map<String, Endpoint> endpoints = new LinkedHashMap<>();
    private volatile String activeId;

    public InMemoryEndpointRegistry(List<Endpoint> endpoints, String activeId) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint must be registered");
        }
        for (Endpoint endpoint : endpoints) {
            if (this.endpoints.putIfAbsent(endpoint.id(), endpoint) != null) {
                throw new IllegalArgumentException("Duplicate endpoint id: " + endpoint.id());
            }
        }
        this.activeId = activeId != null ? activeId : endpoints.get(0).id();
    }

    public InMemoryEndpointRegistry(Endpoint endpoint) {
        this(List.of(endpoint), endpoint.id());
    }

    /**
     * Returns the active endpoint, or the first registered one when the active id
     * does not name a registered endpoint.
     */
    @Override
    public Endpoint current() {
        Endpoint active = endpoints.get(activeId);
        return active != null ? active : endpoints.values().iterator().next();
    }

    public List<Endpoint> list() {
        return new ArrayList<>(endpoints.values());
    }

    public Optional<Endpoint> find(String id) {
        return Optional.ofNullable(endpoints.get(id));
    }

    /**
     * Makes the given endpoint the active one.
     *
     * @throws IllegalArgumentException if no endpoint with that id is registered
     */
    public Endpoint activate(String id) {
        Endpoint endpoint = endpoints.get(id);
        if (endpoint == null) {
            throw new IllegalArgumentException("Unknown endpoint: " + id + ". Available: " +
                    String.join(", ", endpoints.keySet()));
        }
        String previous = activeId;
        activeId = id;
        log.info("endpoint.activated id={} previous={}", id, previous);
        return endpoint;
    }

    /**
     * Finds the id of the endpoint whose host appears in the given URL.
     */
    public Optional<String> findIdByUrl(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return endpoints.values().stream()
                .filter(e -> url.contains(e.host()))
                .map(Endpoint::id)
                .findFirst();
    }

    public String activeId() {
        return current().id();
    }

    @Override
    public String toString() {
        return endpoints.keySet().stream()
                .map(id -> id.equals(activeId()) ? id + " (ACTIVE)" : id)
                .collect(Collectors.joining(", ", "InMemoryEndpointRegistry[", "]"));
    }
}
