package com.tradesim.engine;

import com.tradesim.core.model.ExitReason;

/**
 * Lifecycle of one open position. HOLDING is the only non-terminal state.
 */
public enum PositionState {
    HOLDING,
    EXIT_TAKE_PROFIT,
    EXIT_STOP_LOSS,
    EXIT_TRAILING,
    EXIT_TIMEOUT,
    EXIT_END_OF_PERIOD;

    public boolean isTerminal() {
        return this != HOLDING;
    }

    public static PositionState of(ExitReason reason) {
        return switch (reason) {
            case TAKE_PROFIT -> EXIT_TAKE_PROFIT;
            case STOP_LOSS -> EXIT_STOP_LOSS;
            case TRAILING_STOP -> EXIT_TRAILING;
            case TIMEOUT -> EXIT_TIMEOUT;
            case END_OF_PERIOD -> EXIT_END_OF_PERIOD;
        };
    }
}
