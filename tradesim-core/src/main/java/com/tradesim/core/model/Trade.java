package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A closed round trip. Append-only record of the trade log.
 *
 * Capital fields are account values: {@code capitalBefore} is the capital just
 * before entry, {@code capitalAfter} the capital once the net proceeds were
 * credited. {@code holdingDuration} is in milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Trade(
    long entryTime,
    double entryPrice,
    long exitTime,
    double exitPrice,
    double quantity,
    double capitalBefore,
    double capitalAfter,
    double capitalCommitted,
    double netProceeds,
    double entryFee,
    double exitFee,
    double returnPct,
    ExitReason exitReason,
    long holdingDuration
) {
    /**
     * Realized profit or loss of this trade in account currency.
     */
    @JsonIgnore
    public double pnl() {
        return netProceeds - capitalCommitted;
    }

    /**
     * Total fees and slippage paid on both legs.
     */
    @JsonIgnore
    public double totalFees() {
        return entryFee + exitFee;
    }

    @JsonIgnore
    public boolean isWin() {
        return pnl() > 0;
    }

    @JsonIgnore
    public boolean isLoss() {
        return pnl() < 0;
    }

    @JsonIgnore
    public double holdingHours() {
        return holdingDuration / (60.0 * 60 * 1000);
    }
}
