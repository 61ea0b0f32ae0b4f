package com.tradesim.engine;

/**
 * Outcome of {@link CapitalLedger#enter}: a new position, or a recoverable skip.
 */
public sealed interface EntryResult permits EntryResult.Entered, EntryResult.Skipped {

    default boolean isEntered() {
        return this instanceof Entered;
    }

    record Entered(Position position) implements EntryResult {
    }

    record Skipped(SkipReason reason, String detail) implements EntryResult {
    }
}
