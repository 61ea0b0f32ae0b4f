package com.tradesim.core.model;

/**
 * Account capital right after a trade closed.
 */
public record EquityPoint(long timestamp, double capital) {
}
