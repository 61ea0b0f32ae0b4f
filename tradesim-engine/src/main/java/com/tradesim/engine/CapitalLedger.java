package com.tradesim.engine;

import com.tradesim.core.model.CostModel;
import com.tradesim.core.model.DoubleEntryException;
import com.tradesim.core.model.ExitReason;
import com.tradesim.core.model.NoPositionException;
import com.tradesim.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the capital of one run and applies all fee and slippage arithmetic.
 *
 * Capital changes exactly twice per round trip: {@link #enter} moves the
 * committed amount out of free capital, {@link #exit} credits the net proceeds.
 * Sizing always starts from the current free capital, so gains and losses
 * compound across trades.
 *
 * Not thread-safe; one ledger belongs to one run.
 */
public class CapitalLedger {

    private static final Logger log = LoggerFactory.getLogger(CapitalLedger.class);

    private final CostModel costs;
    private final double initialCapital;
    private double currentCapital;     // Free capital, excludes the open position's commitment
    private double peakCapital;
    private double maxDrawdownPct;
    private double realizedPnl;
    private double totalFees;
    private Position openPosition;

    public CapitalLedger(double initialCapital, CostModel costs) {
        if (!(initialCapital > 0) || Double.isInfinite(initialCapital)) {
            throw new IllegalArgumentException("initial capital must be > 0, got " + initialCapital);
        }
        this.costs = costs;
        this.initialCapital = initialCapital;
        this.currentCapital = initialCapital;
        this.peakCapital = initialCapital;
    }

    /**
     * Open a position with {@code fraction} of the current free capital.
     *
     * The friction is taken from the committed amount before converting to
     * asset quantity: {@code qty = (committed - fee) / entryPrice}.
     *
     * @return the new position, or a skip when the order would be below the minimum order value
     * @throws DoubleEntryException if a position is already open
     */
    public EntryResult enter(long entryTime, double fraction, double entryPrice) {
        if (openPosition != null) {
            throw new DoubleEntryException(openPosition.getEntryTime(), entryTime);
        }
        if (!(fraction >= 0 && fraction <= 1)) {
            throw new IllegalArgumentException("fraction must be in [0, 1], got " + fraction);
        }
        if (!(entryPrice > 0) || Double.isInfinite(entryPrice)) {
            throw new IllegalArgumentException("entry price must be > 0, got " + entryPrice);
        }

        double committed = currentCapital * fraction;
        if (committed <= 0 || committed < costs.minOrderValue()) {
            String detail = String.format("order %.2f below minimum %.2f (capital %.2f x %.4f)",
                committed, costs.minOrderValue(), currentCapital, fraction);
            return new EntryResult.Skipped(SkipReason.INSUFFICIENT_CAPITAL, detail);
        }

        double fee = committed * costs.frictionRate();
        double quantity = (committed - fee) / entryPrice;

        Position position = new Position(entryTime, entryPrice, quantity, committed, fee, currentCapital);
        currentCapital -= committed;
        totalFees += fee;
        openPosition = position;
        updatePeak(currentCapital + committed);

        log.debug("Entered {} at {} committing {} (fee {})", quantity, entryPrice, committed, fee);
        return new EntryResult.Entered(position);
    }

    /**
     * Close the open position at {@code exitPrice} and credit the net proceeds.
     *
     * @throws NoPositionException if no position is open
     */
    public Trade exit(long exitTime, double exitPrice, ExitReason reason) {
        if (openPosition == null) {
            throw new NoPositionException(exitTime);
        }
        if (!(exitPrice > 0) || Double.isInfinite(exitPrice)) {
            throw new IllegalArgumentException("exit price must be > 0, got " + exitPrice);
        }

        Position position = openPosition;
        double gross = position.getAssetQuantity() * exitPrice;
        double fee = gross * costs.frictionRate();
        double net = gross - fee;
        double committed = position.getCapitalCommitted();
        double returnPct = (net - committed) / committed * 100;

        currentCapital += net;
        realizedPnl += net - committed;
        totalFees += fee;
        openPosition = null;
        updatePeak(currentCapital);

        Trade trade = new Trade(
            position.getEntryTime(),
            position.getEntryPrice(),
            exitTime,
            exitPrice,
            position.getAssetQuantity(),
            position.getCapitalBeforeEntry(),
            currentCapital,
            committed,
            net,
            position.getEntryFee(),
            fee,
            returnPct,
            reason,
            exitTime - position.getEntryTime()
        );
        log.debug("Exited at {} ({}) return {}%, capital {}", exitPrice, reason.getValue(), returnPct, currentCapital);
        return trade;
    }

    private void updatePeak(double equity) {
        if (equity > peakCapital) {
            peakCapital = equity;
        }
        double drawdown = (peakCapital - equity) / peakCapital * 100;
        if (drawdown > maxDrawdownPct) {
            maxDrawdownPct = drawdown;
        }
    }

    public boolean hasOpenPosition() {
        return openPosition != null;
    }

    public Position getOpenPosition() {
        return openPosition;
    }

    public double getInitialCapital() {
        return initialCapital;
    }

    /**
     * Free capital available for sizing. Excludes capital committed to the open position.
     */
    public double getCurrentCapital() {
        return currentCapital;
    }

    /**
     * Free capital plus the open position valued at its committed cost.
     */
    public double getEquityAtCost() {
        return openPosition != null ? currentCapital + openPosition.getCapitalCommitted() : currentCapital;
    }

    public double getPeakCapital() {
        return peakCapital;
    }

    /**
     * Largest decline from a capital peak, in percent, over entry and exit events.
     */
    public double getMaxDrawdownPct() {
        return maxDrawdownPct;
    }

    public double getRealizedPnl() {
        return realizedPnl;
    }

    public double getTotalFees() {
        return totalFees;
    }

    public CostModel getCosts() {
        return costs;
    }
}
