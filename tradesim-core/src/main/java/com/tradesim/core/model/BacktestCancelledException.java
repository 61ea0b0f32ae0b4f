package com.tradesim.core.model;

/**
 * Thrown when a run is cancelled before reaching the end of the bar series.
 * No partial report is produced.
 */
public class BacktestCancelledException extends BacktestException {

    private final int barsProcessed;

    public BacktestCancelledException(String runName, int barsProcessed) {
        super("Backtest '" + runName + "' cancelled after " + barsProcessed + " bars");
        this.barsProcessed = barsProcessed;
    }

    public int getBarsProcessed() {
        return barsProcessed;
    }
}
