package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Locale;

/**
 * OHLCV bar of the simulated price series.
 * Timestamp is the bar open time in epoch milliseconds.
 */
public record Bar(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    /**
     * Convert to CSV format.
     */
    public String toCsv() {
        return String.format(Locale.ROOT, "%d,%.8f,%.8f,%.8f,%.8f,%.8f",
            timestamp, open, high, low, close, volume);
    }

    /**
     * Check if all prices are finite and positive and the high/low bracket open and close.
     */
    @JsonIgnore
    public boolean isConsistent() {
        if (!isPositive(open) || !isPositive(high) || !isPositive(low) || !isPositive(close)) {
            return false;
        }
        if (Double.isNaN(volume) || volume < 0) {
            return false;
        }
        return high >= low && high >= Math.max(open, close) && low <= Math.min(open, close);
    }

    private static boolean isPositive(double v) {
        return Double.isFinite(v) && v > 0;
    }
}
