package com.tradesim.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Signal metadata handling.
 */
class SignalTest {

    @Test
    @DisplayName("Metadata is copied on construction")
    void metadataIsCopied() {
        Map<String, Object> source = new HashMap<>();
        source.put("fraction", 0.3);

        Signal signal = new Signal(1_000, 100, null, source);
        source.put("fraction", 0.9);
        source.put("strategy", "v35");

        assertEquals(0.3, signal.metadataNumber("fraction"), 1e-12);
        assertFalse(signal.metadata().containsKey("strategy"));
    }

    @Test
    @DisplayName("Metadata cannot be modified through the accessor")
    void metadataIsUnmodifiable() {
        Signal signal = new Signal(1_000, 100, null, Map.of("fraction", 0.3));

        assertThrows(UnsupportedOperationException.class, () -> signal.metadata().put("fraction", 1.0));
    }

    @Test
    @DisplayName("Missing metadata reads as empty")
    void missingMetadata() {
        Signal signal = new Signal(1_000, 100);

        assertTrue(signal.metadata().isEmpty());
        assertNull(signal.metadataNumber("fraction"));
    }
}
