package com.tradesim.core.io;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.MalformedInputException;
import com.tradesim.core.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputValidator.
 */
class InputValidatorTest {

    private static Bar bar(long time, double low, double high, double close) {
        return new Bar(time, close, high, low, close, 1);
    }

    @Test
    @DisplayName("Empty inputs are valid")
    void emptyInputs() {
        assertDoesNotThrow(() -> InputValidator.validateBars(List.of()));
        assertDoesNotThrow(() -> InputValidator.validateSignals(List.of()));
    }

    @Test
    @DisplayName("Strictly increasing consistent bars are valid")
    void validBars() {
        assertDoesNotThrow(() -> InputValidator.validateBars(List.of(bar(1, 99, 101, 100), bar(2, 99, 101, 100))));
    }

    @Test
    @DisplayName("Null inputs are rejected")
    void nullInputs() {
        assertThrows(MalformedInputException.class, () -> InputValidator.validateBars(null));
        assertThrows(MalformedInputException.class, () -> InputValidator.validateSignals(null));
        assertThrows(MalformedInputException.class,
            () -> InputValidator.validateSignals(Arrays.asList(new Signal(1, 1), null)));
    }

    @Test
    @DisplayName("Bar with NaN price is rejected")
    void nanBar() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
            () -> InputValidator.validateBars(List.of(bar(1, 99, 101, 100), bar(2, Double.NaN, 101, 100))));
        assertEquals(1, e.getIndex());
        assertEquals("bars", e.getSource());
    }

    @Test
    @DisplayName("Bar whose low is above the close is rejected")
    void inconsistentBar() {
        assertThrows(MalformedInputException.class,
            () -> InputValidator.validateBars(List.of(bar(1, 100.5, 101, 100))));
    }

    @Test
    @DisplayName("Duplicate signal timestamps are rejected")
    void duplicateSignals() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
            () -> InputValidator.validateSignals(List.of(new Signal(5, 1), new Signal(5, 2))));
        assertTrue(e.getMessage().contains("duplicate"));
    }

    @Test
    @DisplayName("Infinite signal score is rejected")
    void infiniteScore() {
        assertThrows(MalformedInputException.class,
            () -> InputValidator.validateSignals(List.of(new Signal(5, 1, Double.POSITIVE_INFINITY, null))));
    }
}
