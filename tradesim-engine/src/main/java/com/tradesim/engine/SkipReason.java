package com.tradesim.engine;

/**
 * Why a signal did not open a position.
 */
public enum SkipReason {
    /** Committed capital would fall below the minimum order value. */
    INSUFFICIENT_CAPITAL
}
