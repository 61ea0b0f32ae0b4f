package com.tradesim.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Bounds and parameters for position sizing.
 *
 * @param type            sizing strategy
 * @param minFraction     lower clamp for the committed fraction
 * @param maxFraction     upper clamp for the committed fraction
 * @param defaultFraction fraction used before enough history exists, and by the fixed modes
 * @param halfKelly       whether the Kelly fraction is damped
 * @param kellyDamping    damping multiplier applied when {@code halfKelly} is set
 * @param lookbackTrades  rolling window of closed trades feeding the Kelly estimate
 * @param minTrades       trades required before the Kelly estimate is trusted
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SizingSettings(
    PositionSizingType type,
    double minFraction,
    double maxFraction,
    double defaultFraction,
    boolean halfKelly,
    double kellyDamping,
    int lookbackTrades,
    int minTrades
) {
    public static final int DEFAULT_LOOKBACK_TRADES = 50;
    public static final int DEFAULT_MIN_TRADES = 10;
    public static final double DEFAULT_KELLY_DAMPING = 0.5;

    public SizingSettings {
        if (type == null) {
            type = PositionSizingType.KELLY;
        }
        if (!(minFraction >= 0 && minFraction <= maxFraction && maxFraction <= 1)) {
            throw new IllegalArgumentException(
                "Fractions must satisfy 0 <= min_fraction <= max_fraction <= 1, got "
                    + minFraction + " / " + maxFraction);
        }
        if (!(defaultFraction >= 0 && defaultFraction <= 1)) {
            throw new IllegalArgumentException("default_fraction must be in [0, 1], got " + defaultFraction);
        }
        if (!(kellyDamping > 0 && kellyDamping <= 1)) {
            throw new IllegalArgumentException("kelly_damping must be in (0, 1], got " + kellyDamping);
        }
        if (lookbackTrades < 1) {
            throw new IllegalArgumentException("lookback_trades must be >= 1, got " + lookbackTrades);
        }
        if (minTrades < 0) {
            throw new IllegalArgumentException("min_trades must be >= 0, got " + minTrades);
        }
    }

    /**
     * Half-Kelly between 10% and 100% of capital, 50% until ten trades are known.
     */
    public static SizingSettings defaults() {
        return new SizingSettings(PositionSizingType.KELLY, 0.1, 1.0, 0.5, true,
            DEFAULT_KELLY_DAMPING, DEFAULT_LOOKBACK_TRADES, DEFAULT_MIN_TRADES);
    }

    /**
     * Always commit the same fraction of capital.
     */
    public static SizingSettings fixed(double fraction) {
        return new SizingSettings(PositionSizingType.FIXED_FRACTION, 0.0, 1.0, fraction, false,
            DEFAULT_KELLY_DAMPING, DEFAULT_LOOKBACK_TRADES, DEFAULT_MIN_TRADES);
    }

    /**
     * Multiplier applied to the raw Kelly fraction.
     */
    public double effectiveDamping() {
        return halfKelly ? kellyDamping : 1.0;
    }

    public double clamp(double fraction) {
        return Math.max(minFraction, Math.min(maxFraction, fraction));
    }
}
