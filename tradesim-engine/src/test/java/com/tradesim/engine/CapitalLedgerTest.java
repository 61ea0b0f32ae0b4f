package com.tradesim.engine;

import com.tradesim.core.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CapitalLedger fee arithmetic and position lifecycle.
 */
class CapitalLedgerTest {

    private static final long T0 = 1_704_067_200_000L;
    private static final long HOUR = 3_600_000L;

    private CapitalLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new CapitalLedger(10_000_000, CostModel.defaults());
    }

    private Position enter(double fraction, double price) {
        EntryResult result = ledger.enter(T0, fraction, price);
        assertTrue(result.isEntered(), "Entry should succeed");
        return ((EntryResult.Entered) result).position();
    }

    @Nested
    @DisplayName("Entry")
    class EntryTests {

        @Test
        @DisplayName("Fee is taken from the committed amount before converting to quantity")
        void feeSubtractedBeforeQuantity() {
            Position position = enter(1.0, 50_000_000);

            assertEquals(10_000_000, position.getCapitalCommitted(), 1e-6);
            assertEquals(7_000, position.getEntryFee(), 1e-6);
            assertEquals(9_993_000.0 / 50_000_000, position.getAssetQuantity(), 1e-12);
            assertEquals(0, ledger.getCurrentCapital(), 1e-6);
        }

        @Test
        @DisplayName("Committed amount is a fraction of current capital")
        void commitsFractionOfCurrentCapital() {
            Position position = enter(0.25, 100);

            assertEquals(2_500_000, position.getCapitalCommitted(), 1e-6);
            assertEquals(7_500_000, ledger.getCurrentCapital(), 1e-6);
            assertEquals(10_000_000, position.getCapitalBeforeEntry(), 1e-6);
            assertEquals(10_000_000, ledger.getEquityAtCost(), 1e-6);
        }

        @Test
        @DisplayName("Order below the minimum order value is skipped")
        void belowMinimumOrderIsSkipped() {
            CapitalLedger small = new CapitalLedger(10_000, CostModel.defaults());

            EntryResult result = small.enter(T0, 0.4, 100);

            assertInstanceOf(EntryResult.Skipped.class, result);
            assertEquals(SkipReason.INSUFFICIENT_CAPITAL, ((EntryResult.Skipped) result).reason());
            assertFalse(small.hasOpenPosition());
            assertEquals(10_000, small.getCurrentCapital(), 1e-9);
        }

        @Test
        @DisplayName("Zero fraction is skipped even without a minimum order value")
        void zeroFractionIsSkipped() {
            CapitalLedger frictionless = new CapitalLedger(1_000, CostModel.frictionless());

            assertFalse(frictionless.enter(T0, 0.0, 100).isEntered());
        }

        @Test
        @DisplayName("Entering while a position is open fails")
        void doubleEntryFails() {
            enter(0.5, 100);

            DoubleEntryException e = assertThrows(DoubleEntryException.class,
                () -> ledger.enter(T0 + HOUR, 0.5, 101));
            assertEquals(T0, e.getOpenEntryTime());
            assertEquals(T0 + HOUR, e.getRequestedTime());
        }

        @Test
        @DisplayName("Invalid fraction or price is rejected")
        void invalidArgumentsRejected() {
            assertThrows(IllegalArgumentException.class, () -> ledger.enter(T0, 1.5, 100));
            assertThrows(IllegalArgumentException.class, () -> ledger.enter(T0, -0.1, 100));
            assertThrows(IllegalArgumentException.class, () -> ledger.enter(T0, 0.5, 0));
            assertThrows(IllegalArgumentException.class, () -> ledger.enter(T0, 0.5, Double.NaN));
        }
    }

    @Nested
    @DisplayName("Exit")
    class ExitTests {

        @Test
        @DisplayName("Round trip at the same price loses both legs of friction")
        void noLossRoundTrip() {
            enter(1.0, 50_000_000);

            Trade trade = ledger.exit(T0 + HOUR, 50_000_000, ExitReason.END_OF_PERIOD);

            assertEquals(-2 * (0.0005 + 0.0002) * 100, trade.returnPct(), 0.001);
            assertTrue(trade.isLoss());
            assertEquals(ledger.getCurrentCapital(), trade.capitalAfter(), 1e-9);
        }

        @Test
        @DisplayName("Take-profit round trip compounds both fee legs")
        void takeProfitRoundTrip() {
            enter(1.0, 50_000_000);

            Trade trade = ledger.exit(T0 + HOUR, 52_500_000, ExitReason.TAKE_PROFIT);

            double expected = 10_000_000 * 0.9993 * 1.05 * 0.9993;
            assertEquals(expected, ledger.getCurrentCapital(), 1e-3);
            assertEquals(expected, trade.netProceeds(), 1e-3);
            assertEquals(HOUR, trade.holdingDuration());
            assertEquals(ExitReason.TAKE_PROFIT, trade.exitReason());
        }

        @Test
        @DisplayName("Uncommitted capital is returned alongside net proceeds")
        void partialCommitmentCredited() {
            enter(0.5, 100);

            Trade trade = ledger.exit(T0 + HOUR, 110, ExitReason.TAKE_PROFIT);

            assertEquals(5_000_000 + trade.netProceeds(), ledger.getCurrentCapital(), 1e-6);
            assertEquals(10_000_000, trade.capitalBefore(), 1e-6);
            assertFalse(ledger.hasOpenPosition());
        }

        @Test
        @DisplayName("Exit with no open position fails")
        void exitWithoutPositionFails() {
            NoPositionException e = assertThrows(NoPositionException.class,
                () -> ledger.exit(T0, 100, ExitReason.STOP_LOSS));
            assertEquals(T0, e.getRequestedTime());
        }

        @Test
        @DisplayName("Second entry sizes from capital after the first exit")
        void compoundsAcrossTrades() {
            enter(0.5, 100);
            ledger.exit(T0 + HOUR, 120, ExitReason.TAKE_PROFIT);
            double capitalAfterFirst = ledger.getCurrentCapital();

            EntryResult second = ledger.enter(T0 + 2 * HOUR, 0.5, 120);

            Position position = ((EntryResult.Entered) second).position();
            assertEquals(capitalAfterFirst * 0.5, position.getCapitalCommitted(), 1e-6);
            assertTrue(position.getCapitalCommitted() > 5_000_000);
        }
    }

    @Nested
    @DisplayName("Accounting")
    class AccountingTests {

        @Test
        @DisplayName("Capital equals initial capital plus realized P&L")
        void capitalConservation() {
            double[][] legs = {{100, 105}, {105, 99}, {99, 99}, {99, 120}};
            long t = T0;
            double pnlSum = 0;
            for (double[] leg : legs) {
                ledger.enter(t, 0.6, leg[0]);
                t += HOUR;
                pnlSum += ledger.exit(t, leg[1], ExitReason.TIMEOUT).pnl();
                t += HOUR;
            }

            assertEquals(10_000_000 + pnlSum, ledger.getCurrentCapital(), 1e-4);
            assertEquals(pnlSum, ledger.getRealizedPnl(), 1e-4);
        }

        @Test
        @DisplayName("Total fees include both legs")
        void totalFeesBothLegs() {
            enter(1.0, 100);
            Trade trade = ledger.exit(T0 + HOUR, 100, ExitReason.TIMEOUT);

            assertEquals(trade.entryFee() + trade.exitFee(), ledger.getTotalFees(), 1e-9);
            assertEquals(trade.totalFees(), ledger.getTotalFees(), 1e-9);
        }

        @Test
        @DisplayName("Losing trade sets drawdown from the capital peak")
        void drawdownTracked() {
            CapitalLedger frictionless = new CapitalLedger(1_000_000, CostModel.frictionless());
            frictionless.enter(T0, 1.0, 100);
            frictionless.exit(T0 + HOUR, 90, ExitReason.STOP_LOSS);

            assertEquals(1_000_000, frictionless.getPeakCapital(), 1e-9);
            assertEquals(10.0, frictionless.getMaxDrawdownPct(), 1e-9);
        }
    }
}
