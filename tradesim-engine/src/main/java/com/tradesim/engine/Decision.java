package com.tradesim.engine;

import com.tradesim.core.model.ExitReason;

/**
 * What the engine does with the current bar: nothing, open a position, or close it.
 */
public sealed interface Decision permits Decision.Hold, Decision.Enter, Decision.Exit {

    Hold HOLD = new Hold();

    static Decision hold() {
        return HOLD;
    }

    static Decision enter(double fraction) {
        return new Enter(fraction);
    }

    static Decision exit(ExitReason reason, double exitPrice) {
        return new Exit(reason, exitPrice);
    }

    default boolean shouldExit() {
        return false;
    }

    /**
     * Exit reason, or null unless this is an exit.
     */
    default ExitReason reason() {
        return null;
    }

    /**
     * Fill price of the exit, or NaN unless this is an exit.
     */
    default double exitPrice() {
        return Double.NaN;
    }

    /**
     * State of the open position after this decision.
     */
    default PositionState state() {
        return PositionState.HOLDING;
    }

    record Hold() implements Decision {
    }

    record Enter(double fraction) implements Decision {
        public Enter {
            if (!(fraction >= 0 && fraction <= 1)) {
                throw new IllegalArgumentException("fraction must be in [0, 1], got " + fraction);
            }
        }
    }

    record Exit(ExitReason reason, double exitPrice) implements Decision {
        @Override
        public boolean shouldExit() {
            return true;
        }

        @Override
        public PositionState state() {
            return PositionState.of(reason);
        }
    }
}
