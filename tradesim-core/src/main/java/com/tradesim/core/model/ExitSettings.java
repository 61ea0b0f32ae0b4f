package com.tradesim.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;

/**
 * Exit triggers for an open position. Thresholds are fractions of the entry
 * price (0.05 = 5%); a null or non-positive threshold disables that trigger,
 * as does a null max hold duration.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExitSettings(
    Double takeProfit,
    Double stopLoss,
    TrailingStopSettings trailingStop,
    Duration maxHoldDuration
) {
    public ExitSettings {
        if (trailingStop == null) {
            trailingStop = TrailingStopSettings.disabled();
        }
        if (takeProfit != null && Double.isNaN(takeProfit)) {
            throw new IllegalArgumentException("take_profit must be a number");
        }
        if (stopLoss != null && (Double.isNaN(stopLoss) || stopLoss >= 1)) {
            throw new IllegalArgumentException("stop_loss must be below 1, got " + stopLoss);
        }
        if (maxHoldDuration != null && (maxHoldDuration.isNegative() || maxHoldDuration.isZero())) {
            throw new IllegalArgumentException("max_hold_duration must be positive, got " + maxHoldDuration);
        }
    }

    /**
     * No exit triggers: positions only close at the end of the data.
     */
    public static ExitSettings none() {
        return new ExitSettings(null, null, TrailingStopSettings.disabled(), null);
    }

    public static ExitSettings takeProfitStopLoss(double takeProfit, double stopLoss) {
        return new ExitSettings(takeProfit, stopLoss, TrailingStopSettings.disabled(), null);
    }

    public boolean hasTakeProfit() {
        return takeProfit != null && takeProfit > 0;
    }

    public boolean hasStopLoss() {
        return stopLoss != null && stopLoss > 0;
    }

    public boolean hasTrailingStop() {
        return trailingStop.enabled();
    }

    public boolean hasTimeout() {
        return maxHoldDuration != null;
    }

    public ExitSettings withTrailingStop(TrailingStopSettings trailing) {
        return new ExitSettings(takeProfit, stopLoss, trailing, maxHoldDuration);
    }

    public ExitSettings withMaxHoldDuration(Duration duration) {
        return new ExitSettings(takeProfit, stopLoss, trailingStop, duration);
    }
}
