package com.analytics.session.pool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransportFaultClassifier Tests")
class TransportFaultClassifierTest {

    private final TransportFaultClassifier classifier = new TransportFaultClassifier();

    @ParameterizedTest
    @ValueSource(strings = {
            "Socket closed",
            "socket hang up",
            "Connection reset by peer",
            "read ECONNRESET",
            "Connection closed unexpectedly",
            "connect: Connection refused",
            "Broken pipe",
            "WebSocket is not open",
            "Transport failure",
            "transport error on channel 3",
            "Communications link failure"
    })
    @DisplayName("Should recognize transport fault messages regardless of case")
    void recognizesPhrases(String message) {
        assertTrue(classifier.isTransportFault(new IllegalStateException(message)));
    }

    @Test
    @DisplayName("Should not classify application faults as transport faults")
    void applicationFault() {
        assertFalse(classifier.isTransportFault(new IllegalArgumentException("Field 'Sales' not found")));
        assertFalse(classifier.isTransportFault(new IllegalStateException((String) null)));
        assertFalse(classifier.isTransportFault(null));
    }

    @Test
    @DisplayName("Should inspect the whole cause chain")
    void causeChain() {
        RuntimeException wrapped = new RuntimeException("Evaluation failed",
                new IllegalStateException("wrapper", new IOException("Connection reset")));

        assertTrue(classifier.isTransportFault(wrapped));
    }

    @Test
    @DisplayName("Should recognize socket exception types without a matching message")
    void exceptionTypes() {
        assertTrue(classifier.isTransportFault(new UncheckedIOException(new SocketException("oops"))));
        assertTrue(classifier.isTransportFault(new RuntimeException(new ClosedChannelException())));
    }

    @Test
    @DisplayName("Should add configured phrases to the defaults")
    void additionalPhrases() {
        TransportFaultClassifier extended = TransportFaultClassifier.withAdditionalPhrases("Proxy Timeout");

        assertTrue(extended.isTransportFault(new IllegalStateException("upstream proxy timeout")));
        assertTrue(extended.isTransportFault(new IllegalStateException("socket closed")));
        assertTrue(extended.getPhrases().contains("proxy timeout"));
    }

    @Test
    @DisplayName("Custom phrase list should replace the defaults")
    void customPhrases() {
        TransportFaultClassifier custom = new TransportFaultClassifier(List.of("gateway gone"));

        assertTrue(custom.isTransportFault(new IllegalStateException("Gateway gone")));
        assertFalse(custom.isTransportFault(new IllegalStateException("socket closed")));
    }

    @Test
    @DisplayName("Should reject an empty phrase list")
    void rejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new TransportFaultClassifier(List.of(" ")));
    }
}
