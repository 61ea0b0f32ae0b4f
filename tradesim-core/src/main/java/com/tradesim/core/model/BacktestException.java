package com.tradesim.core.model;

/**
 * Base class for failures that abort a backtest run.
 */
public abstract class BacktestException extends RuntimeException {

    protected BacktestException(String message) {
        super(message);
    }

    protected BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
