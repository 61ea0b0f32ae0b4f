package com.tradesim.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Immutable configuration for one backtest run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BacktestConfig(
    String name,
    double initialCapital,
    CostModel costs,
    SizingSettings sizing,
    ExitSettings exits
) {
    public BacktestConfig {
        if (name == null || name.isBlank()) {
            name = "backtest";
        }
        if (!(initialCapital > 0) || Double.isInfinite(initialCapital)) {
            throw new IllegalArgumentException("initial_capital must be > 0, got " + initialCapital);
        }
        if (costs == null) {
            costs = CostModel.defaults();
        }
        if (sizing == null) {
            sizing = SizingSettings.defaults();
        }
        if (exits == null) {
            exits = ExitSettings.none();
        }
    }

    /**
     * Create default config: 10,000,000 capital, default costs and half-Kelly sizing, no exits.
     */
    public static BacktestConfig defaults() {
        return new BacktestConfig("backtest", 10_000_000, CostModel.defaults(),
            SizingSettings.defaults(), ExitSettings.none());
    }

    public BacktestConfig withName(String newName) {
        return new BacktestConfig(newName, initialCapital, costs, sizing, exits);
    }

    public BacktestConfig withExits(ExitSettings newExits) {
        return new BacktestConfig(name, initialCapital, costs, sizing, newExits);
    }

    public BacktestConfig withSizing(SizingSettings newSizing) {
        return new BacktestConfig(name, initialCapital, costs, newSizing, exits);
    }
}
