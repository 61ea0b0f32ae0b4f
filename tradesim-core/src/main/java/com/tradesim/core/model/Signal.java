package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An entry signal produced by an external signal source.
 *
 * The timestamp is epoch milliseconds (UTC). Score and metadata are optional
 * and only consulted by sizing modes that read them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Signal(
    long timestamp,
    double price,
    Double score,
    Map<String, Object> metadata
) {
    public Signal {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Signal without score or metadata.
     */
    public Signal(long timestamp, double price) {
        this(timestamp, price, null, null);
    }

    /**
     * Read a numeric metadata value, or null when absent or not a number.
     */
    @JsonIgnore
    public Double metadataNumber(String key) {
        Object value = metadata.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
