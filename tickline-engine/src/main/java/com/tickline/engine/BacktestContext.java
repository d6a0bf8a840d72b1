package com.tickline.engine;

import com.tickline.core.model.BacktestException;
import com.tickline.core.model.Bar;
import com.tickline.core.model.FeatureRow;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Encapsulates all market data needed for a backtest run.
 * Separates data preparation (done by the caller) from execution (done by the engine).
 *
 * Every map is keyed by symbol and iterated in symbol order. Series are
 * validated on construction: bars strictly ascending with positive opens,
 * feature rows strictly ascending, state vectors no longer than the bars they
 * align with.
 */
public record BacktestContext(
    // Per-symbol bars, strictly ascending by timestamp
    Map<String, List<Bar>> bars,

    // Precomputed features (optional per symbol), timestamp-aligned with the bars
    Map<String, List<FeatureRow>> features,

    // Precomputed state vectors (optional per symbol), index-aligned with the bars
    Map<String, List<double[]>> states
) {
    public BacktestContext {
        bars = sortedCopy(bars);
        features = sortedCopy(features);
        states = sortedCopy(states);
        validate(bars, features, states);
    }

    /**
     * Create a minimal context with just bars.
     */
    public static BacktestContext ofBars(Map<String, List<Bar>> bars) {
        return new BacktestContext(bars, Map.of(), Map.of());
    }

    /**
     * Single-symbol context.
     */
    public static BacktestContext ofBars(String symbol, List<Bar> bars) {
        return ofBars(Map.of(symbol, bars));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> symbols() {
        return List.copyOf(bars.keySet());
    }

    public boolean isEmpty() {
        return bars.values().stream().allMatch(List::isEmpty);
    }

    public List<FeatureRow> featuresFor(String symbol) {
        return features.get(symbol);
    }

    public List<double[]> statesFor(String symbol) {
        return states.get(symbol);
    }

    private static <T> Map<String, List<T>> sortedCopy(Map<String, List<T>> source) {
        if (source == null) {
            return Collections.emptyMap();
        }
        Map<String, List<T>> copy = new TreeMap<>();
        for (Map.Entry<String, List<T>> e : source.entrySet()) {
            if (e.getKey() == null) {
                throw invalid("Null symbol in market data");
            }
            if (e.getValue() == null) {
                throw invalid("Null series for symbol " + e.getKey());
            }
            for (T element : e.getValue()) {
                if (element == null) {
                    throw invalid("Null entry in series for symbol " + e.getKey());
                }
            }
            copy.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static void validate(Map<String, List<Bar>> bars,
                                 Map<String, List<FeatureRow>> features,
                                 Map<String, List<double[]>> states) {
        for (Map.Entry<String, List<Bar>> e : bars.entrySet()) {
            String symbol = e.getKey();
            long previous = Long.MIN_VALUE;
            for (Bar bar : e.getValue()) {
                if (bar.timestamp() <= previous) {
                    throw invalid("Bars for " + symbol + " must be strictly ascending, found "
                        + bar.timestamp() + " after " + previous);
                }
                if (!(bar.open() > 0)) {
                    throw invalid("Bar for " + symbol + " at " + bar.timestamp() + " has non-positive open " + bar.open());
                }
                previous = bar.timestamp();
            }
        }

        for (Map.Entry<String, List<FeatureRow>> e : features.entrySet()) {
            if (!bars.containsKey(e.getKey())) {
                throw invalid("Features supplied for unknown symbol " + e.getKey());
            }
            long previous = Long.MIN_VALUE;
            for (FeatureRow row : e.getValue()) {
                if (row.timestamp() <= previous) {
                    throw invalid("Features for " + e.getKey() + " must be strictly ascending");
                }
                previous = row.timestamp();
            }
        }

        for (Map.Entry<String, List<double[]>> e : states.entrySet()) {
            List<Bar> symbolBars = bars.get(e.getKey());
            if (symbolBars == null) {
                throw invalid("States supplied for unknown symbol " + e.getKey());
            }
            if (e.getValue().size() > symbolBars.size()) {
                throw invalid("States for " + e.getKey() + " outnumber its bars ("
                    + e.getValue().size() + " > " + symbolBars.size() + ")");
            }
        }
    }

    private static BacktestException invalid(String message) {
        return new BacktestException(BacktestException.ErrorCode.INVALID_MARKET_DATA, message);
    }

    /**
     * Builder for creating multi-symbol contexts.
     */
    public static class Builder {
        private final Map<String, List<Bar>> bars = new TreeMap<>();
        private final Map<String, List<FeatureRow>> features = new TreeMap<>();
        private final Map<String, List<double[]>> states = new TreeMap<>();

        private Builder() {
        }

        public Builder bars(String symbol, List<Bar> symbolBars) {
            bars.put(symbol, symbolBars);
            return this;
        }

        public Builder features(String symbol, List<FeatureRow> rows) {
            if (rows != null) {
                features.put(symbol, rows);
            }
            return this;
        }

        public Builder states(String symbol, List<double[]> vectors) {
            if (vectors != null) {
                states.put(symbol, vectors);
            }
            return this;
        }

        public BacktestContext build() {
            return new BacktestContext(bars, features, states);
        }
    }
}
