package com.tradesim.engine;

import com.tradesim.core.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PositionSizer Kelly and fixed sizing.
 */
class PositionSizerTest {

    private static final Signal SIGNAL = new Signal(1_704_067_200_000L, 100);

    private PositionSizer sizer;
    private SizingSettings kelly;

    @BeforeEach
    void setUp() {
        sizer = new PositionSizer();
        kelly = SizingSettings.defaults();
    }

    // Helper to create a closed trade with the given return percent
    private static Trade trade(double returnPct) {
        double committed = 1_000;
        double net = committed * (1 + returnPct / 100);
        return new Trade(0, 100, 3_600_000L, 100 * (1 + returnPct / 100), 10,
            committed, net, committed, net, 0, 0, returnPct, ExitReason.TIMEOUT, 3_600_000L);
    }

    private static List<Trade> trades(int wins, double winPct, int losses, double lossPct) {
        List<Trade> list = new ArrayList<>();
        for (int i = 0; i < wins; i++) {
            list.add(trade(winPct));
        }
        for (int i = 0; i < losses; i++) {
            list.add(trade(lossPct));
        }
        return list;
    }

    @Nested
    @DisplayName("Kelly sizing")
    class KellyTests {

        @Test
        @DisplayName("Uses the default fraction before enough trades are known")
        void defaultFractionBelowMinTrades() {
            assertEquals(0.5, sizer.size(List.of(), SIGNAL, kelly), 1e-12);
            assertEquals(0.5, sizer.size(trades(5, 4, 4, -2), SIGNAL, kelly), 1e-12);
        }

        @Test
        @DisplayName("Half-Kelly from win rate and reward/risk")
        void halfKelly() {
            // p = 0.6, b = 2 -> f = 0.6 - 0.4 / 2 = 0.4, damped to 0.2
            double fraction = sizer.size(trades(6, 4, 4, -2), SIGNAL, kelly);

            assertEquals(0.2, fraction, 1e-9);
        }

        @Test
        @DisplayName("Full Kelly when damping is off")
        void fullKelly() {
            SizingSettings full = new SizingSettings(PositionSizingType.KELLY, 0.1, 1.0, 0.5, false,
                SizingSettings.DEFAULT_KELLY_DAMPING, 50, 10);

            assertEquals(0.4, sizer.size(trades(6, 4, 4, -2), SIGNAL, full), 1e-9);
        }

        @Test
        @DisplayName("No losing trades sizes at the maximum fraction")
        void noLossesUsesMax() {
            assertEquals(1.0, sizer.size(trades(12, 3, 0, 0), SIGNAL, kelly), 1e-12);
        }

        @Test
        @DisplayName("No winning trades gives a zero reward/risk and sizes at the maximum fraction")
        void noWinsUsesMax() {
            assertEquals(1.0, sizer.size(trades(0, 0, 12, -1), SIGNAL, kelly), 1e-12);
        }

        @Test
        @DisplayName("Negative Kelly falls back to the minimum fraction")
        void negativeKellyUsesMin() {
            // p = 0.3, b = 0.5 -> f = 0.3 - 0.7 / 0.5 = -1.1
            assertEquals(0.1, sizer.size(trades(3, 1, 7, -2), SIGNAL, kelly), 1e-12);
        }

        @Test
        @DisplayName("Result is clamped to the configured bounds")
        void clampedToBounds() {
            SizingSettings narrow = new SizingSettings(PositionSizingType.KELLY, 0.3, 0.35, 0.5, true, 0.5, 50, 10);

            assertEquals(0.3, sizer.size(trades(6, 4, 4, -2), SIGNAL, narrow), 1e-12);
            assertEquals(0.35, sizer.size(List.of(), SIGNAL, narrow), 1e-12);
        }

        @Test
        @DisplayName("Only the most recent trades feed the estimate")
        void rollingWindow() {
            SizingSettings window = new SizingSettings(PositionSizingType.KELLY, 0.1, 1.0, 0.5, true, 0.5, 10, 10);
            List<Trade> history = trades(0, 0, 40, -3);
            history.addAll(trades(10, 2, 0, 0));

            assertEquals(1.0, sizer.size(history, SIGNAL, window), 1e-12);
        }

        @Test
        @DisplayName("Estimate reports win rate and average win and loss")
        void estimateValues() {
            PositionSizer.KellyEstimate estimate = PositionSizer.estimate(trades(6, 4, 4, -2));

            assertEquals(10, estimate.trades());
            assertEquals(0.6, estimate.winRate(), 1e-12);
            assertEquals(4, estimate.avgWin(), 1e-12);
            assertEquals(2, estimate.avgLoss(), 1e-12);
            assertEquals(2, estimate.rewardRiskRatio(), 1e-12);
            assertEquals(0.4, estimate.kelly(), 1e-12);
        }

        @Test
        @DisplayName("Break-even trades count in the sample but are neither wins nor losses")
        void breakEvenTrades() {
            List<Trade> history = trades(2, 4, 2, -2);
            history.add(trade(0));

            PositionSizer.KellyEstimate estimate = PositionSizer.estimate(history);

            assertEquals(5, estimate.trades());
            assertEquals(0.4, estimate.winRate(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Fixed and signal sizing")
    class FixedSizingTests {

        @Test
        @DisplayName("Fixed fraction ignores history")
        void fixedFraction() {
            SizingSettings fixed = SizingSettings.fixed(0.3);

            assertEquals(0.3, sizer.size(trades(6, 4, 4, -2), SIGNAL, fixed), 1e-12);
        }

        @Test
        @DisplayName("Signal fraction is read from metadata")
        void signalFraction() {
            SizingSettings settings = new SizingSettings(PositionSizingType.SIGNAL_FRACTION,
                0.1, 0.8, 0.5, false, 0.5, 50, 10);
            Signal withFraction = new Signal(0, 100, 0.9, Map.of("fraction", 0.25));
            Signal tooLarge = new Signal(0, 100, 0.9, Map.of("fraction", 2.0));
            Signal textual = new Signal(0, 100, null, Map.of("fraction", "0.4"));

            assertEquals(0.25, sizer.size(List.of(), withFraction, settings), 1e-12);
            assertEquals(0.8, sizer.size(List.of(), tooLarge, settings), 1e-12);
            assertEquals(0.4, sizer.size(List.of(), textual, settings), 1e-12);
            assertEquals(0.5, sizer.size(List.of(), SIGNAL, settings), 1e-12);
        }

        @Test
        @DisplayName("A zero fraction decides to hold")
        void zeroFractionHolds() {
            Decision decision = sizer.decide(List.of(), SIGNAL, SizingSettings.fixed(0.0));

            assertInstanceOf(Decision.Hold.class, decision);
            assertFalse(decision.shouldExit());
        }

        @Test
        @DisplayName("A positive fraction decides to enter")
        void positiveFractionEnters() {
            Decision decision = sizer.decide(List.of(), SIGNAL, SizingSettings.fixed(0.7));

            Decision.Enter enter = assertInstanceOf(Decision.Enter.class, decision);
            assertEquals(0.7, enter.fraction(), 1e-12);
        }
    }
}
