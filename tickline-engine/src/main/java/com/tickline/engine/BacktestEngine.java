package com.tickline.engine;

import com.tickline.core.journal.OrderEvent;
import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.BacktestException;
import com.tickline.core.model.BacktestResult;
import com.tickline.core.model.Bar;
import com.tickline.core.model.FeatureRow;
import com.tickline.core.model.FeatureWindow;
import com.tickline.core.model.Signal;
import com.tickline.core.strategy.Strategy;
import com.tickline.core.strategy.StrategyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Event-driven backtesting engine.
 *
 * Walks the merged timeline of all symbols once, in ascending order. At each
 * timestamp it fills due orders at the bar's open, marks positions at the
 * close, records an equity sample, asks the strategy for signals per symbol
 * (in symbol order) and queues the resulting orders.
 *
 * The engine only holds its configuration. All run state is created per call,
 * so independent engines may run on separate threads and one engine may be
 * reused sequentially.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    static final String REASON_UNKNOWN_SYMBOL = "unknown symbol";
    static final String REASON_NO_FURTHER_BARS = "no further bars";

    private final BacktestConfig config;

    public BacktestEngine(BacktestConfig config) {
        if (config == null) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG, "Backtest config is required");
        }
        this.config = config;
    }

    public BacktestConfig getConfig() {
        return config;
    }

    /**
     * Run a strategy over the context without progress reporting.
     */
    public BacktestResult run(BacktestContext context, Strategy strategy) {
        return run(context, strategy, null);
    }

    /**
     * Run a strategy over the context.
     *
     * @param context    validated market data, features and states
     * @param strategy   signal source, called once per symbol per timestamp
     * @param onProgress progress callback, may be null
     * @return the immutable result of the run
     */
    public BacktestResult run(BacktestContext context, Strategy strategy, Consumer<Progress> onProgress) {
        if (context == null || strategy == null) {
            throw new IllegalArgumentException("Context and strategy are required");
        }
        long startTime = System.currentTimeMillis();
        String runId = BacktestResult.newRunId();
        long[] timeline = TimelineMerger.merge(context.bars());

        log.info("Backtest {} started: strategy={}, symbols={}, timestamps={}, capital={}",
            runId, strategy.getName(), context.symbols(), timeline.length, config.initialCapital());

        RunState state = new RunState(config);
        try {
            loop(context, strategy, timeline, state, onProgress);
        } catch (BacktestException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Backtest {} aborted", runId, e);
            throw new BacktestException(BacktestException.ErrorCode.SIMULATION_ERROR,
                "Backtest " + runId + " aborted: " + e.getMessage(), e);
        }

        BacktestResult result = ResultAssembler.assemble(runId, config, state, context.symbols(),
            timeline.length, startTime);
        log.info("Backtest {} finished in {} ms: {} trades, {} errors, final equity {}",
            runId, result.duration(), result.trades().size(), result.errors().size(), result.finalEquity());
        return result;
    }

    private void loop(BacktestContext context, Strategy strategy, long[] timeline,
                      RunState state, Consumer<Progress> onProgress) {
        Map<String, Integer> barCursor = new HashMap<>();
        Map<String, Integer> featureCursor = new HashMap<>();
        int progressInterval = Math.max(1, timeline.length / 100);

        for (int i = 0; i < timeline.length; i++) {
            long timestamp = timeline[i];

            // Bars present at this timestamp, keyed by symbol in sorted order
            Map<String, Integer> barIndex = new TreeMap<>();
            Map<String, Bar> current = new TreeMap<>();
            for (Map.Entry<String, List<Bar>> e : context.bars().entrySet()) {
                String symbol = e.getKey();
                List<Bar> bars = e.getValue();
                int cursor = barCursor.getOrDefault(symbol, 0);
                if (cursor < bars.size() && bars.get(cursor).timestamp() == timestamp) {
                    barIndex.put(symbol, cursor);
                    current.put(symbol, bars.get(cursor));
                    barCursor.put(symbol, cursor + 1);
                }
            }

            if (config.fillOnNextBar()) {
                executePending(context, state, current, barCursor, timestamp);
            }

            state.portfolio.markToMarket(current);
            state.recordSample(timestamp);

            for (Map.Entry<String, Integer> e : barIndex.entrySet()) {
                String symbol = e.getKey();
                FeatureWindow window = buildWindow(context, symbol, e.getValue(), timestamp, featureCursor);
                if (window == null) {
                    log.debug("No feature row for {} at {}, skipping", symbol, timestamp);
                    continue;
                }
                double[] stateVector = stateVector(context, symbol, e.getValue());

                SignalOutcome outcome = evaluate(strategy, window, timestamp, stateVector);
                if (!outcome.isSuccess()) {
                    state.errors.add(outcome.error());
                    continue;
                }
                for (Signal signal : outcome.signals()) {
                    Signal addressed = signal.isDefaultSymbol() ? signal.withSymbol(symbol) : signal;
                    state.signals.add(addressed);
                    queue(context, state, addressed, timestamp);
                }
            }

            if (!config.fillOnNextBar()) {
                executePending(context, state, current, barCursor, timestamp);
            }

            if (onProgress != null && (i % progressInterval == 0 || i == timeline.length - 1)) {
                int percentage = (int) ((i + 1) * 100L / timeline.length);
                onProgress.accept(new Progress(i + 1, timeline.length, percentage,
                    "Processed " + (i + 1) + " / " + timeline.length + " timestamps"));
            }
        }
    }

    private void queue(BacktestContext context, RunState state, Signal signal, long timestamp) {
        List<PendingOrder> orders = state.adapter.translate(signal, timestamp);
        for (PendingOrder order : orders) {
            if (!context.bars().containsKey(order.symbol())) {
                // Never fillable: no bar will ever arrive for this symbol
                state.journal.log(OrderEvent.dropped(timestamp, order.symbol(), order.action(),
                    order.queuedAt(), order.size(), REASON_UNKNOWN_SYMBOL));
                log.info("Dropped {} for unknown symbol {} at {}", order.action(), order.symbol(), timestamp);
                continue;
            }
            state.pending.addLast(order);
        }
    }

    /**
     * Execute queued orders FIFO. Orders whose symbol has no bar at this
     * timestamp keep their relative order and wait for the next step; the
     * first such wait is journaled as DEFERRED. Orders whose symbol has no
     * bars left are dropped.
     */
    private void executePending(BacktestContext context, RunState state, Map<String, Bar> current,
                                Map<String, Integer> barCursor, long timestamp) {
        if (state.pending.isEmpty()) {
            return;
        }
        Deque<PendingOrder> deferred = new ArrayDeque<>();
        while (!state.pending.isEmpty()) {
            PendingOrder order = state.pending.pollFirst();
            Bar bar = current.get(order.symbol());
            if (bar != null) {
                state.deferred.remove(order);
                state.simulator.execute(order, bar, timestamp).ifPresent(state.trades::add);
                continue;
            }
            int remaining = context.bars().get(order.symbol()).size() - barCursor.getOrDefault(order.symbol(), 0);
            if (remaining <= 0) {
                state.deferred.remove(order);
                state.journal.log(OrderEvent.dropped(timestamp, order.symbol(), order.action(),
                    order.queuedAt(), order.size(), REASON_NO_FURTHER_BARS));
                log.info("Dropped {} for {} at {}: {}", order.action(), order.symbol(), timestamp,
                    REASON_NO_FURTHER_BARS);
                continue;
            }
            if (state.deferred.add(order)) {
                state.journal.log(OrderEvent.deferred(timestamp, order.symbol(), order.action(),
                    order.queuedAt(), order.size()));
            }
            deferred.addLast(order);
        }
        state.pending.addAll(deferred);
    }

    private SignalOutcome evaluate(Strategy strategy, FeatureWindow window, long timestamp, double[] stateVector) {
        String symbol = window.symbol();
        try {
            return SignalOutcome.ok(symbol, timestamp, strategy.generateSignals(window, timestamp, stateVector));
        } catch (StrategyException | RuntimeException e) {
            log.warn("Strategy {} failed for {} at {}", strategy.getName(), symbol, timestamp, e);
            return SignalOutcome.failed(symbol, timestamp, e);
        }
    }

    /**
     * Trailing window ending at the bar at {@code barIndex}, or null when the
     * symbol has features but none at this timestamp.
     */
    private FeatureWindow buildWindow(BacktestContext context, String symbol, int barIndex,
                                      long timestamp, Map<String, Integer> featureCursor) {
        List<Bar> bars = context.bars().get(symbol);
        int barFrom = windowStart(barIndex);
        List<Bar> barWindow = bars.subList(barFrom, barIndex + 1);

        List<FeatureRow> rows = context.featuresFor(symbol);
        if (rows == null) {
            return FeatureWindow.ofBars(symbol, timestamp, barWindow);
        }

        int cursor = featureCursor.getOrDefault(symbol, 0);
        while (cursor < rows.size() && rows.get(cursor).timestamp() < timestamp) {
            cursor++;
        }
        featureCursor.put(symbol, cursor);
        if (cursor >= rows.size() || rows.get(cursor).timestamp() != timestamp) {
            return null;
        }
        List<FeatureRow> featureWindow = rows.subList(windowStart(cursor), cursor + 1);
        return new FeatureWindow(symbol, timestamp, barWindow, featureWindow);
    }

    private int windowStart(int lastIndex) {
        int size = config.featureWindowBars();
        return size > 0 ? Math.max(0, lastIndex + 1 - size) : 0;
    }

    private static double[] stateVector(BacktestContext context, String symbol, int barIndex) {
        List<double[]> states = context.statesFor(symbol);
        if (states == null || barIndex >= states.size()) {
            return null;
        }
        return states.get(barIndex).clone();
    }

    /**
     * Progress update for a running backtest.
     */
    public record Progress(int current, int total, int percentage, String message) {}
}
