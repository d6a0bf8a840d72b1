package com.tickline.core.model;

import java.util.AbstractList;
import java.util.Collections;
import java.util.List;

/**
 * Trailing view of one symbol's history, ending at the bar being evaluated.
 * Both lists are read-only and ordered oldest first; the last element is
 * the current observation.
 *
 * When no precomputed features were supplied for the symbol, {@link #features()}
 * exposes raw OHLCV rows derived from the bars.
 */
public record FeatureWindow(
    String symbol,
    long timestamp,
    List<Bar> bars,
    List<FeatureRow> features
) {
    public FeatureWindow {
        bars = Collections.unmodifiableList(bars);
        features = features != null ? Collections.unmodifiableList(features) : ohlcvView(bars);
    }

    public static FeatureWindow ofBars(String symbol, long timestamp, List<Bar> bars) {
        return new FeatureWindow(symbol, timestamp, bars, null);
    }

    public Bar currentBar() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    public FeatureRow currentFeatures() {
        return features.isEmpty() ? null : features.get(features.size() - 1);
    }

    public int size() {
        return features.size();
    }

    private static List<FeatureRow> ohlcvView(List<Bar> bars) {
        return new AbstractList<>() {
            @Override
            public FeatureRow get(int index) {
                return FeatureRow.ofBar(bars.get(index));
            }

            @Override
            public int size() {
                return bars.size();
            }
        };
    }
}
