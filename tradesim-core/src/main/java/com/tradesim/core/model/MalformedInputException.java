package com.tradesim.core.model;

/**
 * Thrown at the load boundary when a signal list or bar series violates the
 * input contract: unsorted or duplicate timestamps, non-finite or non-positive
 * prices, or bars whose high/low do not bracket open and close.
 */
public class MalformedInputException extends BacktestException {

    private final String source;
    private final int index;

    public MalformedInputException(String source, int index, String problem) {
        super(buildMessage(source, index, problem));
        this.source = source;
        this.index = index;
    }

    public MalformedInputException(String source, int index, String problem, Throwable cause) {
        super(buildMessage(source, index, problem), cause);
        this.source = source;
        this.index = index;
    }

    private static String buildMessage(String source, int index, String problem) {
        return index >= 0
            ? String.format("Malformed %s at index %d: %s", source, index, problem)
            : String.format("Malformed %s: %s", source, problem);
    }

    /**
     * Which input was rejected ("bars", "signals" or a file name).
     */
    public String getSource() {
        return source;
    }

    /**
     * Offending record index, or -1 when the problem is not tied to one record.
     */
    public int getIndex() {
        return index;
    }
}
