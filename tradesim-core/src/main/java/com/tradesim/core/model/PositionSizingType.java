package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of position sizing strategies.
 */
public enum PositionSizingType {
    KELLY("kelly"),
    FIXED_FRACTION("fixed_fraction"),
    SIGNAL_FRACTION("signal_fraction");

    private final String value;

    PositionSizingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PositionSizingType fromValue(String value) {
        if (value == null) return KELLY;
        for (PositionSizingType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown position sizing type: " + value);
    }
}
