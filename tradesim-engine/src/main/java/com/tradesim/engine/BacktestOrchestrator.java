package com.tradesim.engine;

import com.tradesim.core.io.InputValidator;
import com.tradesim.core.io.Timestamps;
import com.tradesim.core.model.BacktestCancelledException;
import com.tradesim.core.model.BacktestConfig;
import com.tradesim.core.model.BacktestReport;
import com.tradesim.core.model.Bar;
import com.tradesim.core.model.ExitReason;
import com.tradesim.core.model.ExitSettings;
import com.tradesim.core.model.Signal;
import com.tradesim.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs a signal list against a bar series and produces a report.
 *
 * Bars are stamped with their open time. Per bar, in order:
 * <ol>
 *   <li>If a position is open, every signal dated before the bar's open arrived
 *       while it was held and is ignored. The position's peak/trailing state is then
 *       updated and the {@link ExitPolicyEvaluator} asked; on an exit the
 *       {@link CapitalLedger} closes it.</li>
 *   <li>Consume every signal whose timestamp is at or before the bar's open. While
 *       flat, the first one is sized by the {@link PositionSizer} and entered at its
 *       own price; the rest arrived while that position was open and are ignored.</li>
 *   <li>A position entered in step 2 is evaluated against the same bar, since the
 *       whole bar trades after its entry. A re-entry on the bar that just closed the
 *       previous position is first evaluated on the next bar.</li>
 * </ol>
 * Every ignored signal is counted in the report. A position still open after the
 * last bar is closed at that bar's close with {@link ExitReason#END_OF_PERIOD}.
 *
 * The orchestrator itself holds no run state, so one instance may serve several
 * runs concurrently; each run builds its own ledger.
 */
public class BacktestOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BacktestOrchestrator.class);
    private static final int PROGRESS_INTERVAL = 500;

    private final PositionSizer positionSizer;
    private final ExitPolicyEvaluator exitEvaluator;
    private final StatisticsAggregator statistics;

    public BacktestOrchestrator() {
        this(new PositionSizer(), new ExitPolicyEvaluator(), new StatisticsAggregator());
    }

    public BacktestOrchestrator(PositionSizer positionSizer, ExitPolicyEvaluator exitEvaluator,
                                StatisticsAggregator statistics) {
        this.positionSizer = positionSizer;
        this.exitEvaluator = exitEvaluator;
        this.statistics = statistics;
    }

    /**
     * Run a backtest without progress reporting or cancellation.
     */
    public BacktestReport run(List<Signal> signals, List<Bar> bars, BacktestConfig config) {
        return run(signals, bars, config, null, () -> false);
    }

    /**
     * Run a backtest.
     *
     * @param signals    entry signals, sorted by timestamp without duplicates
     * @param bars       price series, strictly increasing in timestamp
     * @param config     capital, costs, sizing and exits
     * @param onProgress optional progress callback
     * @param cancelled  optional, checked before every bar; returning true aborts the run
     * @return the complete report
     * @throws com.tradesim.core.model.MalformedInputException if the inputs are malformed
     * @throws BacktestCancelledException if {@code cancelled} fired
     */
    public BacktestReport run(List<Signal> signals, List<Bar> bars, BacktestConfig config,
                              Consumer<Progress> onProgress, BooleanSupplier cancelled) {
        InputValidator.validateSignals(signals);
        InputValidator.validateBars(bars);

        long startTime = System.currentTimeMillis();
        log.info("Starting backtest '{}': {} signals, {} bars, capital {}",
            config.name(), signals.size(), bars.size(), config.initialCapital());

        CapitalLedger ledger = new CapitalLedger(config.initialCapital(), config.costs());
        ExitSettings exits = config.exits();
        List<Trade> trades = new ArrayList<>();
        int signalIndex = 0;
        int entered = 0;
        int ignoredWhileOpen = 0;
        int skippedInsufficient = 0;

        for (int i = 0; i < bars.size(); i++) {
            if (cancelled != null && cancelled.getAsBoolean()) {
                log.info("Backtest '{}' cancelled at bar {} of {}", config.name(), i, bars.size());
                throw new BacktestCancelledException(config.name(), i);
            }
            Bar bar = bars.get(i);

            boolean exitedThisBar = false;
            if (ledger.hasOpenPosition()) {
                while (signalIndex < signals.size() && signals.get(signalIndex).timestamp() < bar.timestamp()) {
                    ignoredWhileOpen++;
                    logIgnored(signals.get(signalIndex++), ledger);
                }
                Trade trade = closeIfTriggered(ledger, bar, exits);
                if (trade != null) {
                    trades.add(trade);
                    exitedThisBar = true;
                }
            }

            boolean enteredThisBar = false;
            while (signalIndex < signals.size() && signals.get(signalIndex).timestamp() <= bar.timestamp()) {
                Signal signal = signals.get(signalIndex++);
                if (ledger.hasOpenPosition() || enteredThisBar) {
                    // Single position per run: later signals are dropped until it closes
                    ignoredWhileOpen++;
                    logIgnored(signal, ledger);
                    continue;
                }

                Decision decision = positionSizer.decide(trades, signal, config.sizing());
                if (!(decision instanceof Decision.Enter enter)) {
                    skippedInsufficient++;
                    log.warn("Skipping signal at {}: sized to zero", Timestamps.format(signal.timestamp()));
                    continue;
                }
                EntryResult result = ledger.enter(signal.timestamp(), enter.fraction(), signal.price());
                if (result instanceof EntryResult.Skipped skipped) {
                    skippedInsufficient++;
                    log.warn("Skipping signal at {}: {}", Timestamps.format(signal.timestamp()), skipped.detail());
                } else {
                    entered++;
                    enteredThisBar = true;
                }
            }

            if (enteredThisBar && !exitedThisBar) {
                Trade trade = closeIfTriggered(ledger, bar, exits);
                if (trade != null) {
                    trades.add(trade);
                }
            }

            if (onProgress != null && (i % PROGRESS_INTERVAL == 0 || i == bars.size() - 1)) {
                int percentage = (int) (((double) (i + 1) / bars.size()) * 100);
                onProgress.accept(new Progress(i + 1, bars.size(), percentage,
                    "Processing bar " + (i + 1) + " of " + bars.size()));
            }
        }

        int afterData = signals.size() - signalIndex;
        if (afterData > 0) {
            log.warn("{} signals are later than the last bar and were not simulated", afterData);
        }

        if (ledger.hasOpenPosition()) {
            Bar last = bars.get(bars.size() - 1);
            trades.add(ledger.exit(last.timestamp(), last.close(), ExitReason.END_OF_PERIOD));
        }

        BacktestReport.SignalCounts counts = new BacktestReport.SignalCounts(
            signals.size(), entered, ignoredWhileOpen, skippedInsufficient, afterData);
        BacktestReport report = statistics.aggregate(config, trades, ledger.getCurrentCapital(), counts);

        log.info("Finished backtest in {} ms: {}", System.currentTimeMillis() - startTime, report.getSummary());
        if (ignoredWhileOpen > 0) {
            log.info("{} signals ignored while a position was open", ignoredWhileOpen);
        }
        return report;
    }

    private Trade closeIfTriggered(CapitalLedger ledger, Bar bar, ExitSettings exits) {
        Position position = ledger.getOpenPosition();
        position.observe(bar, exits.trailingStop());
        Decision decision = exitEvaluator.evaluate(position, bar, exits);
        if (decision instanceof Decision.Exit exit) {
            return ledger.exit(bar.timestamp(), exit.exitPrice(), exit.reason());
        }
        return null;
    }

    private static void logIgnored(Signal signal, CapitalLedger ledger) {
        if (log.isDebugEnabled()) {
            Position open = ledger.getOpenPosition();
            log.debug("Ignoring signal at {}: position open since {}",
                Timestamps.format(signal.timestamp()),
                open != null ? Timestamps.format(open.getEntryTime()) : "this bar");
        }
    }
}
