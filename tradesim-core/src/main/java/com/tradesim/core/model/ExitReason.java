package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a position was closed.
 */
public enum ExitReason {
    TAKE_PROFIT("take_profit"),
    STOP_LOSS("stop_loss"),
    TRAILING_STOP("trailing_stop"),
    TIMEOUT("timeout"),
    END_OF_PERIOD("end_of_period");

    private final String value;

    ExitReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ExitReason fromValue(String value) {
        for (ExitReason reason : values()) {
            if (reason.value.equals(value) || reason.name().equals(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown exit reason: " + value);
    }
}
