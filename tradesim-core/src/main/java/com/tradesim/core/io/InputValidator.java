package com.tradesim.core.io;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.MalformedInputException;
import com.tradesim.core.model.Signal;

import java.util.List;

/**
 * Load-boundary checks for simulation inputs. Everything here runs before the
 * first bar is simulated, so a malformed input never surfaces mid-run.
 */
public final class InputValidator {

    private InputValidator() {
    }

    /**
     * Require a strictly increasing bar series with consistent, finite prices.
     */
    public static void validateBars(List<Bar> bars) {
        if (bars == null) {
            throw new MalformedInputException("bars", -1, "bar series is null");
        }
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null) {
                throw new MalformedInputException("bars", i, "null bar");
            }
            if (i > 0 && bar.timestamp() == previous) {
                throw new MalformedInputException("bars", i, "duplicate timestamp " + bar.timestamp());
            }
            if (bar.timestamp() < previous) {
                throw new MalformedInputException("bars", i,
                    "timestamp " + bar.timestamp() + " precedes " + previous);
            }
            if (!bar.isConsistent()) {
                throw new MalformedInputException("bars", i, "inconsistent or non-finite prices " + bar);
            }
            previous = bar.timestamp();
        }
    }

    /**
     * Require signals sorted by timestamp without duplicates and with a usable price.
     */
    public static void validateSignals(List<Signal> signals) {
        if (signals == null) {
            throw new MalformedInputException("signals", -1, "signal list is null");
        }
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < signals.size(); i++) {
            Signal signal = signals.get(i);
            if (signal == null) {
                throw new MalformedInputException("signals", i, "null signal");
            }
            if (i > 0 && signal.timestamp() == previous) {
                throw new MalformedInputException("signals", i, "duplicate timestamp " + signal.timestamp());
            }
            if (signal.timestamp() < previous) {
                throw new MalformedInputException("signals", i,
                    "timestamp " + signal.timestamp() + " precedes " + previous);
            }
            if (!Double.isFinite(signal.price()) || signal.price() <= 0) {
                throw new MalformedInputException("signals", i, "invalid price " + signal.price());
            }
            if (signal.score() != null && !Double.isFinite(signal.score())) {
                throw new MalformedInputException("signals", i, "non-finite score");
            }
            previous = signal.timestamp();
        }
    }
}
