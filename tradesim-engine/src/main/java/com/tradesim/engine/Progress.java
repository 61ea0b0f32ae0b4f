package com.tradesim.engine;

/**
 * Progress of a running backtest, reported through the optional callback.
 */
public record Progress(int current, int total, int percentage, String message) {
}
