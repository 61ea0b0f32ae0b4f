package com.tradesim.core.model;

/**
 * Thrown when an entry is requested while a position is already open.
 * Only one position may exist per run, so this always indicates a driver bug.
 */
public class DoubleEntryException extends BacktestException {

    private final long openEntryTime;
    private final long requestedTime;

    public DoubleEntryException(long openEntryTime, long requestedTime) {
        super(String.format(
            "Entry requested at %d while the position opened at %d is still open",
            requestedTime, openEntryTime));
        this.openEntryTime = openEntryTime;
        this.requestedTime = requestedTime;
    }

    public long getOpenEntryTime() {
        return openEntryTime;
    }

    public long getRequestedTime() {
        return requestedTime;
    }
}
