package com.tradesim.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Order friction assumptions applied to both legs of every trade.
 *
 * @param feeRate       exchange fee as a fraction of order value (0.0005 = 0.05%)
 * @param slippageRate  assumed execution degradation as a fraction of order value
 * @param minOrderValue smallest order the venue accepts, in account currency
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CostModel(double feeRate, double slippageRate, double minOrderValue) {

    public CostModel {
        requireRate("fee_rate", feeRate);
        requireRate("slippage_rate", slippageRate);
        if (!Double.isFinite(minOrderValue) || minOrderValue < 0) {
            throw new IllegalArgumentException("min_order_value must be >= 0, got " + minOrderValue);
        }
    }

    /**
     * Upbit KRW spot defaults: 0.05% fee, 0.02% slippage, 5,000 minimum order.
     */
    public static CostModel defaults() {
        return new CostModel(0.0005, 0.0002, 5_000);
    }

    /**
     * No fees, no slippage, no minimum order.
     */
    public static CostModel frictionless() {
        return new CostModel(0, 0, 0);
    }

    /**
     * Combined friction rate charged on one leg.
     */
    public double frictionRate() {
        return feeRate + slippageRate;
    }

    private static void requireRate(String name, double value) {
        if (!Double.isFinite(value) || value < 0 || value >= 1) {
            throw new IllegalArgumentException(name + " must be in [0, 1), got " + value);
        }
    }
}
