package com.tradesim.engine;

import com.tradesim.core.model.Signal;
import com.tradesim.core.model.SizingSettings;
import com.tradesim.core.model.Trade;

import java.util.List;

/**
 * Decides what fraction of free capital a new signal commits.
 * Supports Kelly criterion sizing over recent trades, a fixed fraction, and a
 * fraction carried by the signal itself. Every result is clamped to
 * {@code [minFraction, maxFraction]}.
 *
 * Stateless; the trade history is passed in by the caller.
 */
public class PositionSizer {

    /** Signal metadata key read by {@code signal_fraction} sizing. */
    public static final String FRACTION_KEY = "fraction";

    /**
     * Calculate the fraction of free capital to commit.
     *
     * @param history  closed trades of the current run, oldest first
     * @param signal   the signal being sized
     * @param settings sizing bounds and parameters
     * @return fraction in [minFraction, maxFraction]
     */
    public double size(List<Trade> history, Signal signal, SizingSettings settings) {
        return switch (settings.type()) {
            case FIXED_FRACTION -> settings.clamp(settings.defaultFraction());
            case SIGNAL_FRACTION -> settings.clamp(signalFraction(signal, settings));
            case KELLY -> kellyFraction(history, settings);
        };
    }

    /**
     * Sizing as an engine decision: enter with the sized fraction, or hold when it is zero.
     */
    public Decision decide(List<Trade> history, Signal signal, SizingSettings settings) {
        double fraction = size(history, signal, settings);
        return fraction > 0 ? Decision.enter(fraction) : Decision.hold();
    }

    /**
     * Kelly criterion sizing: f = p - (1 - p) / b over the last {@code lookbackTrades} trades,
     * damped and clamped.
     */
    double kellyFraction(List<Trade> history, SizingSettings settings) {
        List<Trade> window = history.size() > settings.lookbackTrades()
            ? history.subList(history.size() - settings.lookbackTrades(), history.size())
            : history;

        if (window.size() < settings.minTrades() || window.isEmpty()) {
            return settings.clamp(settings.defaultFraction());
        }

        KellyEstimate estimate = estimate(window);
        if (!estimate.hasLosses() || !(estimate.rewardRiskRatio() > 0)) {
            return settings.maxFraction();
        }

        double damped = estimate.kelly() * settings.effectiveDamping();
        if (damped < 0) {
            return settings.minFraction();
        }
        return settings.clamp(damped);
    }

    private double signalFraction(Signal signal, SizingSettings settings) {
        Double fraction = signal != null ? signal.metadataNumber(FRACTION_KEY) : null;
        if (fraction == null || !Double.isFinite(fraction)) {
            return settings.defaultFraction();
        }
        return fraction;
    }

    /**
     * Win rate and reward/risk over a set of trades, using per-trade return percent.
     */
    public static KellyEstimate estimate(List<Trade> trades) {
        int wins = 0;
        int losses = 0;
        double winSum = 0;
        double lossSum = 0;
        for (Trade t : trades) {
            if (t.returnPct() > 0) {
                wins++;
                winSum += t.returnPct();
            } else if (t.returnPct() < 0) {
                losses++;
                lossSum += Math.abs(t.returnPct());
            }
        }
        int total = trades.size();
        double winRate = total > 0 ? (double) wins / total : 0;
        double avgWin = wins > 0 ? winSum / wins : 0;
        double avgLoss = losses > 0 ? lossSum / losses : 0;
        return new KellyEstimate(total, winRate, avgWin, avgLoss);
    }

    /**
     * Inputs and result of the Kelly formula.
     *
     * @param trades  number of trades in the sample
     * @param winRate share of trades with a positive return
     * @param avgWin  mean winning return percent
     * @param avgLoss mean absolute losing return percent (0 when there are no losses)
     */
    public record KellyEstimate(int trades, double winRate, double avgWin, double avgLoss) {

        public boolean hasLosses() {
            return avgLoss > 0;
        }

        /**
         * avgWin / avgLoss, or NaN when there are no losing trades.
         */
        public double rewardRiskRatio() {
            return avgLoss > 0 ? avgWin / avgLoss : Double.NaN;
        }

        /**
         * Raw Kelly fraction p - (1 - p) / b. Negative infinity when there are no wins,
         * NaN when there are no losses.
         */
        public double kelly() {
            double b = rewardRiskRatio();
            if (Double.isNaN(b)) {
                return Double.NaN;
            }
            if (b == 0) {
                return Double.NEGATIVE_INFINITY;
            }
            return winRate - (1 - winRate) / b;
        }
    }
}
