package com.tradesim.engine;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.TrailingStopSettings;

/**
 * State of the single open position of a run.
 * Created by {@link CapitalLedger#enter}, updated once per bar by the
 * orchestrator, and turned into a trade by {@link CapitalLedger#exit}.
 */
public class Position {
    private final long entryTime;
    private final double entryPrice;
    private final double assetQuantity;
    private final double capitalCommitted;
    private final double entryFee;
    private final double capitalBeforeEntry;  // Account capital just before this entry
    private double peakPriceSinceEntry;
    private boolean trailingArmed;

    Position(long entryTime, double entryPrice, double assetQuantity,
             double capitalCommitted, double entryFee, double capitalBeforeEntry) {
        this.entryTime = entryTime;
        this.entryPrice = entryPrice;
        this.assetQuantity = assetQuantity;
        this.capitalCommitted = capitalCommitted;
        this.entryFee = entryFee;
        this.capitalBeforeEntry = capitalBeforeEntry;
        this.peakPriceSinceEntry = entryPrice;
        this.trailingArmed = false;
    }

    /**
     * Track the peak price and arm the trailing stop once the peak profit
     * reached the activation threshold. Call once per bar before exits are evaluated.
     */
    public void observe(Bar bar, TrailingStopSettings trailing) {
        if (bar.high() > peakPriceSinceEntry) {
            peakPriceSinceEntry = bar.high();
        }
        if (!trailingArmed && trailing.enabled() && peakProfitFraction() >= trailing.activationPct()) {
            trailingArmed = true;
        }
    }

    /**
     * Best unrealized gain seen so far, as a fraction of entry price.
     */
    public double peakProfitFraction() {
        return (peakPriceSinceEntry - entryPrice) / entryPrice;
    }

    public long getEntryTime() {
        return entryTime;
    }

    public double getEntryPrice() {
        return entryPrice;
    }

    public double getAssetQuantity() {
        return assetQuantity;
    }

    public double getCapitalCommitted() {
        return capitalCommitted;
    }

    public double getEntryFee() {
        return entryFee;
    }

    public double getCapitalBeforeEntry() {
        return capitalBeforeEntry;
    }

    public double getPeakPriceSinceEntry() {
        return peakPriceSinceEntry;
    }

    public boolean isTrailingArmed() {
        return trailingArmed;
    }

    @Override
    public String toString() {
        return String.format("Position[entry=%.2f @ %d, qty=%.8f, committed=%.2f, peak=%.2f, armed=%s]",
            entryPrice, entryTime, assetQuantity, capitalCommitted, peakPriceSinceEntry, trailingArmed);
    }
}
