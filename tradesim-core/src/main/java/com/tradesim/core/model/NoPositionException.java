package com.tradesim.core.model;

/**
 * Thrown when an exit is requested with no open position.
 */
public class NoPositionException extends BacktestException {

    private final long requestedTime;

    public NoPositionException(long requestedTime) {
        super("Exit requested at " + requestedTime + " but no position is open");
        this.requestedTime = requestedTime;
    }

    public long getRequestedTime() {
        return requestedTime;
    }
}
