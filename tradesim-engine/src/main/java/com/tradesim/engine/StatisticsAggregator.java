package com.tradesim.engine;

import com.tradesim.core.model.BacktestConfig;
import com.tradesim.core.model.BacktestReport;
import com.tradesim.core.model.EquityPoint;
import com.tradesim.core.model.ExitReason;
import com.tradesim.core.model.Trade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the report from a finished trade log.
 *
 * Total return compares final and initial capital, since compounded per-trade
 * returns cannot be summed. Drawdown is measured on the equity curve sampled at
 * trade closes only. Degenerate inputs (no trades, a single trade, zero
 * variance, no losing trades) map to fixed values, never NaN or infinity.
 */
public class StatisticsAggregator {

    public BacktestReport aggregate(BacktestConfig config, List<Trade> trades, double finalCapital,
                                    BacktestReport.SignalCounts signals) {
        double initialCapital = config.initialCapital();

        int winners = 0;
        int losers = 0;
        double grossWin = 0;
        double grossLoss = 0;
        double winPctSum = 0;
        double lossPctSum = 0;
        double largestWinPct = 0;
        double largestLossPct = 0;
        double returnSum = 0;
        double holdingHours = 0;
        double totalFees = 0;
        Map<String, Integer> exitReasons = new LinkedHashMap<>();
        for (ExitReason reason : ExitReason.values()) {
            exitReasons.put(reason.getValue(), 0);
        }

        for (Trade t : trades) {
            if (t.isWin()) {
                winners++;
                grossWin += t.pnl();
                winPctSum += t.returnPct();
                largestWinPct = Math.max(largestWinPct, t.returnPct());
            } else if (t.isLoss()) {
                losers++;
                grossLoss += Math.abs(t.pnl());
                lossPctSum += t.returnPct();
                largestLossPct = Math.min(largestLossPct, t.returnPct());
            }
            returnSum += t.returnPct();
            holdingHours += t.holdingHours();
            totalFees += t.totalFees();
            exitReasons.merge(t.exitReason().getValue(), 1, Integer::sum);
        }

        int total = trades.size();
        double winRate = total > 0 ? (double) winners / total : 0;
        double avgReturn = total > 0 ? returnSum / total : 0;
        double profitFactor;
        if (grossLoss > 0) {
            profitFactor = grossWin / grossLoss;
        } else {
            profitFactor = grossWin > 0 ? BacktestReport.PROFIT_FACTOR_NO_LOSSES : 0;
        }

        List<EquityPoint> equityCurve = equityCurve(trades);
        PositionSizer.KellyEstimate kelly = PositionSizer.estimate(trades);
        double kellyFull = kelly.hasLosses() && kelly.avgWin() > 0
            ? Math.max(0, Math.min(kelly.kelly(), 1))
            : 0;

        return new BacktestReport(
            config.name(),
            initialCapital,
            finalCapital,
            finite((finalCapital - initialCapital) / initialCapital * 100),
            total,
            winRate,
            finite(avgReturn),
            sharpeRatio(trades),
            maxDrawdownPct(initialCapital, equityCurve),
            finite(profitFactor),
            winners,
            losers,
            winners > 0 ? finite(winPctSum / winners) : 0,
            losers > 0 ? finite(lossPctSum / losers) : 0,
            largestWinPct,
            largestLossPct,
            total > 0 ? holdingHours / total : 0,
            finalCapital - initialCapital,
            totalFees,
            kellyFull,
            kellyFull * 0.5,
            kellyFull * 0.25,
            Collections.unmodifiableMap(exitReasons),
            signals != null ? signals : BacktestReport.SignalCounts.none(),
            equityCurve,
            config,
            List.copyOf(trades)
        );
    }

    /**
     * Mean over sample standard deviation of per-trade return percent.
     * Not annualised. 0 with fewer than two trades or zero deviation.
     */
    public double sharpeRatio(List<Trade> trades) {
        int n = trades.size();
        if (n < 2) {
            return 0;
        }
        double mean = trades.stream().mapToDouble(Trade::returnPct).average().orElse(0);
        double sumSq = 0;
        for (Trade t : trades) {
            sumSq += Math.pow(t.returnPct() - mean, 2);
        }
        double stdDev = Math.sqrt(sumSq / (n - 1));
        if (!(stdDev > 1e-12)) {
            return 0;
        }
        return finite(mean / stdDev);
    }

    /**
     * Largest peak-to-trough decline in percent, starting from the initial capital.
     */
    public double maxDrawdownPct(double initialCapital, List<EquityPoint> equityCurve) {
        double peak = initialCapital;
        double maxDrawdown = 0;
        for (EquityPoint point : equityCurve) {
            if (point.capital() > peak) {
                peak = point.capital();
            }
            double drawdown = (peak - point.capital()) / peak * 100;
            maxDrawdown = Math.max(maxDrawdown, drawdown);
        }
        return finite(maxDrawdown);
    }

    /**
     * Capital after each trade close.
     */
    public List<EquityPoint> equityCurve(List<Trade> trades) {
        List<EquityPoint> curve = new ArrayList<>(trades.size());
        for (Trade t : trades) {
            curve.add(new EquityPoint(t.exitTime(), t.capitalAfter()));
        }
        return curve;
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0;
    }
}
