package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One precomputed feature observation for a symbol.
 * Feature names map to values, e.g. "rsi_14" -> 41.3.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeatureRow(
    long timestamp,
    Map<String, Double> values
) {
    public FeatureRow {
        values = values != null ? Collections.unmodifiableMap(values) : Map.of();
    }

    /**
     * Raw OHLCV row, used when no precomputed features exist for a symbol.
     */
    public static FeatureRow ofBar(Bar bar) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("open", bar.open());
        values.put("high", bar.high());
        values.put("low", bar.low());
        values.put("close", bar.close());
        values.put("volume", bar.volume());
        return new FeatureRow(bar.timestamp(), values);
    }

    /**
     * Value of a feature, or NaN when absent.
     */
    public double get(String name) {
        Double value = values.get(name);
        return value != null ? value : Double.NaN;
    }
}
