package com.tickline.runner;

import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.BacktestException;
import com.tickline.core.model.BacktestResult;
import com.tickline.core.model.Bar;
import com.tickline.core.model.FeatureRow;
import com.tickline.core.model.PerformanceMetrics;
import com.tickline.core.model.Trade;
import com.tickline.core.strategy.Strategy;
import com.tickline.core.strategy.StrategyFactory;
import com.tickline.engine.BacktestContext;
import com.tickline.engine.BacktestEngine;
import com.tickline.engine.TimelineMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rolling walk-forward validation.
 *
 * The data range is cut into consecutive train/test windows. Each window gets
 * a fresh strategy from the factory, which is run on the training slice and
 * then on the following test slice, each time on a fresh engine. Windows run
 * concurrently on a fixed pool; results come back in window order.
 */
public class WalkForwardRunner {

    private static final Logger log = LoggerFactory.getLogger(WalkForwardRunner.class);

    private final WalkForwardConfig config;
    private final BacktestConfig backtestConfig;
    private final int periodsPerYear;

    public WalkForwardRunner(WalkForwardConfig config, BacktestConfig backtestConfig) {
        this(config, backtestConfig, PerformanceMetrics.DEFAULT_PERIODS_PER_YEAR);
    }

    public WalkForwardRunner(WalkForwardConfig config, BacktestConfig backtestConfig, int periodsPerYear) {
        if (config == null || backtestConfig == null) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG,
                "Walk-forward and backtest configs are required");
        }
        if (periodsPerYear <= 0) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG,
                "periodsPerYear must be positive: " + periodsPerYear);
        }
        this.config = config;
        this.backtestConfig = backtestConfig;
        this.periodsPerYear = periodsPerYear;
    }

    /**
     * Run every window and combine the out-of-sample results.
     *
     * @throws BacktestException NO_WINDOWS when the data is too short for a single window
     */
    public WalkForwardResult run(BacktestContext context, StrategyFactory strategyFactory) {
        List<WalkForwardWindow> planned = generateWindows(context);
        if (planned.isEmpty()) {
            throw new BacktestException(BacktestException.ErrorCode.NO_WINDOWS,
                "No walk-forward window fits the data (train " + config.trainPeriodDays()
                    + "d + test " + config.testPeriodDays() + "d)");
        }
        log.info("Walk-forward started: {} windows, parallelism {}", planned.size(), config.parallelism());

        List<WalkForwardWindow> windows = runAll(context, strategyFactory, planned);

        List<SortedMap<Long, Double>> testCurves = new ArrayList<>();
        List<Trade> testTrades = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (WalkForwardWindow w : windows) {
            testCurves.add(w.testResult().equityCurve());
            testTrades.addAll(w.testResult().trades());
            w.trainResult().errors().forEach(e -> errors.add("window " + w.windowId() + " train: " + e));
            w.testResult().errors().forEach(e -> errors.add("window " + w.windowId() + " test: " + e));
        }

        SortedMap<Long, Double> combined = combineEquityCurves(testCurves, backtestConfig.initialCapital());
        PerformanceMetrics combinedMetrics = PerformanceMetrics.calculate(
            combinedResult(context, combined, testTrades, errors), periodsPerYear);

        WalkForwardResult result = new WalkForwardResult(
            config,
            List.copyOf(windows),
            combined,
            List.copyOf(testTrades),
            combinedMetrics,
            MetricsSummary.of(windows.stream().map(WalkForwardWindow::trainMetrics).toList()),
            MetricsSummary.of(windows.stream().map(WalkForwardWindow::testMetrics).toList()),
            List.copyOf(errors)
        );
        log.info("Walk-forward finished: {}", result.getSummary());
        return result;
    }

    /**
     * Windows laid out from the first timestamp of the data. A window is kept
     * only while its test end does not pass the last timestamp.
     */
    public List<WalkForwardWindow> generateWindows(BacktestContext context) {
        long[] timeline = TimelineMerger.merge(context.bars());
        List<WalkForwardWindow> windows = new ArrayList<>();
        if (timeline.length == 0) {
            return windows;
        }
        long first = timeline[0];
        long last = timeline[timeline.length - 1];

        long start = first;
        int id = 0;
        while (true) {
            long trainEnd = start + config.trainMillis();
            long testEnd = trainEnd + config.testMillis();
            if (testEnd > last) {
                break;
            }
            windows.add(WalkForwardWindow.planned(id++, start, trainEnd, trainEnd, testEnd));
            start += config.stepMillis();
        }
        return windows;
    }

    /**
     * Sub-context with every series restricted to [from, to). States stay
     * index-aligned with the sliced bars. Symbols without bars in the range
     * are left out.
     */
    public static BacktestContext slice(BacktestContext context, long from, long to) {
        BacktestContext.Builder builder = BacktestContext.builder();
        for (Map.Entry<String, List<Bar>> e : context.bars().entrySet()) {
            String symbol = e.getKey();
            List<Bar> bars = e.getValue();

            int lo = 0;
            while (lo < bars.size() && bars.get(lo).timestamp() < from) {
                lo++;
            }
            int hi = lo;
            while (hi < bars.size() && bars.get(hi).timestamp() < to) {
                hi++;
            }
            if (hi == lo) {
                continue;
            }
            builder.bars(symbol, bars.subList(lo, hi));

            List<FeatureRow> rows = context.featuresFor(symbol);
            if (rows != null) {
                builder.features(symbol, rows.stream()
                    .filter(r -> r.timestamp() >= from && r.timestamp() < to)
                    .toList());
            }
            List<double[]> states = context.statesFor(symbol);
            if (states != null) {
                builder.states(symbol, states.subList(Math.min(lo, states.size()), Math.min(hi, states.size())));
            }
        }
        return builder.build();
    }

    /**
     * Chain equity curves: each curve is normalized to its first value and
     * scaled to where the previous one ended. Later curves drop their first
     * point, which coincides with the previous curve's last.
     */
    public static SortedMap<Long, Double> combineEquityCurves(List<SortedMap<Long, Double>> curves, double startValue) {
        SortedMap<Long, Double> combined = new TreeMap<>();
        double scale = startValue;
        boolean first = true;
        for (SortedMap<Long, Double> curve : curves) {
            if (curve.isEmpty()) {
                continue;
            }
            double base = curve.get(curve.firstKey());
            boolean skipHead = !first;
            double lastValue = scale;
            for (Map.Entry<Long, Double> point : curve.entrySet()) {
                double value = point.getValue() / base * scale;
                lastValue = value;
                if (skipHead) {
                    skipHead = false;
                    continue;
                }
                combined.put(point.getKey(), value);
            }
            scale = lastValue;
            first = false;
        }
        return Collections.unmodifiableSortedMap(combined);
    }

    private List<WalkForwardWindow> runAll(BacktestContext context, StrategyFactory strategyFactory,
                                           List<WalkForwardWindow> planned) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(config.parallelism(), planned.size()), r -> {
                Thread t = new Thread(r, "WalkForward-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        try {
            List<Future<WalkForwardWindow>> futures = new ArrayList<>();
            for (WalkForwardWindow window : planned) {
                futures.add(executor.submit(() -> runWindow(context, strategyFactory, window)));
            }
            List<WalkForwardWindow> completed = new ArrayList<>();
            for (Future<WalkForwardWindow> future : futures) {
                completed.add(future.get());
            }
            return completed;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof BacktestException be) {
                throw be;
            }
            throw new BacktestException(BacktestException.ErrorCode.SIMULATION_ERROR,
                "Walk-forward window failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BacktestException(BacktestException.ErrorCode.SIMULATION_ERROR,
                "Walk-forward interrupted", e);
        } finally {
            executor.shutdownNow();
            try {
                executor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private WalkForwardWindow runWindow(BacktestContext context, StrategyFactory strategyFactory,
                                        WalkForwardWindow window) {
        Strategy strategy = strategyFactory.create();
        BacktestContext train = slice(context, window.trainStart(), window.trainEnd());
        BacktestContext test = slice(context, window.testStart(), window.testEnd());

        BacktestResult trainResult = new BacktestEngine(backtestConfig).run(train, strategy);
        BacktestResult testResult = new BacktestEngine(backtestConfig).run(test, strategy);

        WalkForwardWindow done = window.withResults(trainResult, testResult, periodsPerYear);
        log.debug("Window {} done: train Sharpe {}, test Sharpe {}",
            window.windowId(), done.trainMetrics().sharpeRatio(), done.testMetrics().sharpeRatio());
        return done;
    }

    private BacktestResult combinedResult(BacktestContext context, SortedMap<Long, Double> equity,
                                          List<Trade> trades, List<String> errors) {
        double finalEquity = equity.isEmpty() ? backtestConfig.initialCapital() : equity.get(equity.lastKey());
        long now = System.currentTimeMillis();
        return new BacktestResult(
            "walk-forward",
            backtestConfig,
            equity,
            List.of(),
            List.copyOf(trades),
            List.of(),
            List.of(),
            List.copyOf(errors),
            finalEquity,
            Map.of(),
            context.symbols(),
            equity.size(),
            now,
            now,
            0
        );
    }
}
