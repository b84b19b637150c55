package com.analytics.session.endpoint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Endpoint Tests")
class EndpointTest {

    @Test
    @DisplayName("Should derive the session URI from the host")
    void sessionUri() {
        Endpoint endpoint = new Endpoint("main", "Main", "https://tenant.example.com/", "key");

        assertEquals("tenant.example.com", endpoint.host());
        assertEquals(URI.create("wss://tenant.example.com/app/app-42"), endpoint.sessionUri("app-42"));
    }

    @Test
    @DisplayName("toString should never expose the credential")
    void masksCredential() {
        Endpoint endpoint = new Endpoint("main", "Main", "https://tenant.example.com", "super-secret");

        assertFalse(endpoint.toString().contains("super-secret"));
        assertTrue(endpoint.toString().contains("****"));
        assertTrue(new Endpoint("dev", null, "https://dev", null).toString().contains("<none>"));
    }

    @Test
    @DisplayName("Should default display name and credential")
    void defaults() {
        Endpoint endpoint = new Endpoint("dev", null, "https://dev.example.com", null);

        assertEquals("dev", endpoint.displayName());
        assertEquals("", endpoint.credential());
        assertFalse(endpoint.hasCredential());
    }

    @Test
    @DisplayName("Should require id and url")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new Endpoint(" ", "x", "https://x", ""));
        assertThrows(IllegalArgumentException.class, () -> new Endpoint("x", "x", null, ""));
    }
}
