package com.tradesim.engine;

import com.tradesim.core.io.InputValidator;
import com.tradesim.core.model.BacktestConfig;
import com.tradesim.core.model.BacktestReport;
import com.tradesim.core.model.Bar;
import com.tradesim.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs several configurations against the same inputs on a fixed thread pool.
 *
 * Inputs are validated once and shared read-only; every run gets its own
 * ledger and position inside {@link BacktestOrchestrator#run}, so runs share
 * no mutable state.
 */
public class ParallelBacktestRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelBacktestRunner.class);

    private final BacktestOrchestrator orchestrator;
    private final ExecutorService executor;

    public ParallelBacktestRunner(int threads) {
        this(new BacktestOrchestrator(), threads);
    }

    public ParallelBacktestRunner(BacktestOrchestrator orchestrator, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.orchestrator = orchestrator;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "BacktestRunner-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run every configuration and return the reports keyed by configuration name,
     * in submission order.
     *
     * @throws IllegalArgumentException if two configurations share a name
     * @throws InterruptedException if interrupted while waiting for the runs
     */
    public Map<String, BacktestReport> runAll(List<Signal> signals, List<Bar> bars,
                                              List<BacktestConfig> configs) throws InterruptedException {
        Set<String> names = new HashSet<>();
        for (BacktestConfig config : configs) {
            if (!names.add(config.name())) {
                throw new IllegalArgumentException("Duplicate configuration name: " + config.name());
            }
        }
        InputValidator.validateSignals(signals);
        InputValidator.validateBars(bars);

        List<Signal> sharedSignals = List.copyOf(signals);
        List<Bar> sharedBars = List.copyOf(bars);

        log.info("Running {} backtests on {} bars", configs.size(), sharedBars.size());
        List<Future<BacktestReport>> futures = new ArrayList<>(configs.size());
        for (BacktestConfig config : configs) {
            futures.add(executor.submit(() -> orchestrator.run(sharedSignals, sharedBars, config)));
        }

        Map<String, BacktestReport> reports = new LinkedHashMap<>();
        try {
            for (int i = 0; i < configs.size(); i++) {
                reports.put(configs.get(i).name(), futures.get(i).get());
            }
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Backtest failed", cause);
        }
        return reports;
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
