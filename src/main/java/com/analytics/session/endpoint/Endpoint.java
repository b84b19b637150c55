package com.analytics.session.endpoint;

import java.net.URI;

/**
 * A remote engine endpoint and the credential used to authenticate against it.
 *
 * @param id          stable identifier used to select the endpoint
 * @param displayName human readable name
 * @param url         base URL of the endpoint, e.g. {@code https://tenant.example.com}
 * @param credential  API key or token; never included in {@link #toString()}
 */
public record Endpoint(String id, String displayName, String url, String credential) {

    public Endpoint {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        displayName = displayName != null ? displayName : id;
        credential = credential != null ? credential : "";
    }

    /**
     * Returns the URL host part without scheme or trailing slash.
     */
    public String host() {
        String host = url.replaceFirst("^[a-zA-Z][a-zA-Z0-9+.-]*://", "");
        while (host.endsWith("/")) {
            host = host.substring(0, host.length() - 1);
        }
        return host;
    }

    /**
     * Builds the engine session URI for a resource on this endpoint.
     */
    public URI sessionUri(String resourceId) {
        return URI.create("wss://" + host() + "/app/" + resourceId);
    }

    public boolean hasCredential() {
        return !credential.isEmpty();
    }

    @Override
    public String toString() {
        return "Endpoint{" +
                "id='" + id + '\'' +
                ", displayName='" + displayName + '\'' +
                ", url='" + url + '\'' +
                ", credential=" + (hasCredential() ? "****" : "<none>") +
                '}';
    }
}
