package com.analytics.session.pool;

import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Separates transport faults (broken socket, reset link) from application faults.
 *
 * <p>An error is a transport fault when its message, or the message of any cause in its
 * chain, contains one of the configured phrases (case-insensitive), or when the chain
 * contains a {@link SocketException} or {@link ClosedChannelException}.</p>
 */
public class TransportFaultClassifier {

    public static final List<String> DEFAULT_PHRASES = List.of(
            "socket closed",
            "socket hang up",
            "connection reset",
            "econnreset",
            "connection closed",
            "connection refused",
            "broken pipe",
            "websocket",
            "transport failure",
            "transport error",
            "link failure"
    );

    private final List<String> phrases;

    public TransportFaultClassifier() {
        this(DEFAULT_PHRASES);
    }

    public TransportFaultClassifier(Collection<String> phrases) {
        List<String> normalized = new ArrayList<>();
        for (String phrase : phrases) {
            if (phrase != null && !phrase.isBlank()) {
                normalized.add(phrase.toLowerCase(Locale.ROOT));
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one transport fault phrase is required");
        }
        this.phrases = List.copyOf(normalized);
    }

    /**
     * Returns a classifier recognizing the default phrases plus the given ones.
     */
    public static TransportFaultClassifier withAdditionalPhrases(String... extra) {
        List<String> all = new ArrayList<>(DEFAULT_PHRASES);
        Collections.addAll(all, extra);
        return new TransportFaultClassifier(all);
    }

    public boolean isTransportFault(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
            if (t instanceof SocketException || t instanceof ClosedChannelException) {
                return true;
            }
            if (matches(t.getMessage())) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPhrases() {
        return phrases;
    }

    private boolean matches(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String phrase : phrases) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
