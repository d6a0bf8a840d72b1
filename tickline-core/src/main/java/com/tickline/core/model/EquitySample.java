package com.tickline.core.model;

import java.util.Collections;
import java.util.Map;

/**
 * Portfolio state at one timestamp, recorded before that step's signals are acted on.
 */
public record EquitySample(
    long timestamp,
    double cash,
    double equity,
    Map<String, PositionSnapshot> positions
) {
    public EquitySample {
        positions = positions != null ? Collections.unmodifiableMap(positions) : Map.of();
    }
}
