package com.tradesim.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Trailing stop trigger. Arms once the peak price reached {@code activationPct}
 * above entry, then fires when the close falls {@code trailPct} (of entry price)
 * below that peak.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrailingStopSettings(boolean enabled, double activationPct, double trailPct) {

    public TrailingStopSettings {
        if (enabled && !(activationPct >= 0 && Double.isFinite(activationPct))) {
            throw new IllegalArgumentException("activation_pct must be >= 0, got " + activationPct);
        }
        if (enabled && !(trailPct > 0 && Double.isFinite(trailPct))) {
            throw new IllegalArgumentException("trail_pct must be > 0, got " + trailPct);
        }
    }

    public static TrailingStopSettings disabled() {
        return new TrailingStopSettings(false, 0, 0);
    }
}
