package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Result of a backtest run. Field names are the stable JSON contract.
 *
 * Percent fields are in percent units (4.85 = 4.85%); {@code winRate} is a ratio
 * in [0, 1]. No field is ever NaN or infinite.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
    "name", "initial_capital", "final_capital", "total_return_pct", "total_trades",
    "win_rate", "avg_return_pct", "sharpe_ratio", "max_drawdown_pct", "profit_factor"
})
public record BacktestReport(
    String name,
    double initialCapital,
    double finalCapital,
    double totalReturnPct,
    int totalTrades,
    double winRate,
    double avgReturnPct,
    double sharpeRatio,
    double maxDrawdownPct,
    double profitFactor,
    // Extended statistics
    int winningTrades,
    int losingTrades,
    double avgWinPct,
    double avgLossPct,
    double largestWinPct,
    double largestLossPct,
    double avgHoldingHours,
    double netProfit,
    double totalFees,
    double kellyFull,
    double kellyHalf,
    double kellyQuarter,
    Map<String, Integer> exitReasonCounts,
    SignalCounts signals,
    List<EquityPoint> equityCurve,
    BacktestConfig config,
    List<Trade> trades
) {
    /**
     * Profit factor reported when there are winning trades and no losing trades.
     */
    public static final double PROFIT_FACTOR_NO_LOSSES = 999.0;

    /**
     * Get summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format(
            "%s: %d trades, %.1f%% win rate, %.2f profit factor, %+.2f%% return, %.2f%% max drawdown",
            name,
            totalTrades,
            winRate * 100,
            profitFactor,
            totalReturnPct,
            maxDrawdownPct
        );
    }

    /**
     * How the signal list was consumed during the run.
     *
     * @param received                 signals supplied to the run
     * @param entered                  signals that opened a position
     * @param ignoredWhileOpen         signals that arrived while a position was open
     * @param skippedInsufficientCapital signals whose order would fall below the minimum order value
     * @param afterData                signals timestamped after the last bar
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SignalCounts(
        int received,
        int entered,
        int ignoredWhileOpen,
        int skippedInsufficientCapital,
        int afterData
    ) {
        public static SignalCounts none() {
            return new SignalCounts(0, 0, 0, 0, 0);
        }
    }
}
