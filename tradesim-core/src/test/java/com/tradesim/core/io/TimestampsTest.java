package com.tradesim.core.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Timestamps parsing.
 */
class TimestampsTest {

    private static final long NEW_YEAR_2024 = 1_704_067_200_000L;

    @Test
    @DisplayName("Parses every accepted form to the same instant")
    void acceptedForms() {
        assertEquals(NEW_YEAR_2024, Timestamps.parse("1704067200000"));
        assertEquals(NEW_YEAR_2024, Timestamps.parse("2024-01-01T00:00:00Z"));
        assertEquals(NEW_YEAR_2024, Timestamps.parse("2024-01-01T09:00:00+09:00"));
        assertEquals(NEW_YEAR_2024, Timestamps.parse("2024-01-01T00:00:00"));
        assertEquals(NEW_YEAR_2024, Timestamps.parse("2024-01-01 00:00:00"));
        assertEquals(NEW_YEAR_2024, Timestamps.parse(" 2024-01-01 "));
    }

    @Test
    @DisplayName("Rejects blank and unknown text")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> Timestamps.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Timestamps.parse("01/01/2024"));
    }

    @Test
    @DisplayName("Formats as an ISO instant")
    void format() {
        assertEquals("2024-01-01T00:00:00Z", Timestamps.format(NEW_YEAR_2024));
    }
}
