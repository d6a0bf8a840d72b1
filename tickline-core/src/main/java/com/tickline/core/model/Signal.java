package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.Map;

/**
 * Directional trading instruction emitted by a strategy.
 *
 * @param timestamp time the signal refers to (epoch millis)
 * @param symbol    target symbol, or {@link #DEFAULT_SYMBOL} to address the symbol being evaluated
 * @param direction LONG, SHORT or FLAT
 * @param strength  conviction in [0, 1]; scales the computed position size
 * @param size      position size in currency; 0 means "let the engine size it"
 * @param metadata  free-form strategy annotations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Signal(
    long timestamp,
    String symbol,
    SignalDirection direction,
    double strength,
    double size,
    Map<String, Object> metadata
) {
    /** Placeholder symbol, replaced by the symbol under evaluation. */
    public static final String DEFAULT_SYMBOL = "default";

    public Signal {
        if (direction == null) {
            throw new IllegalArgumentException("Signal direction is required");
        }
        if (Double.isNaN(strength) || strength < 0 || strength > 1) {
            throw new IllegalArgumentException("Signal strength must be in [0, 1]: " + strength);
        }
        if (!Double.isFinite(size) || size < 0) {
            throw new IllegalArgumentException("Signal size must be finite and >= 0: " + size);
        }
        symbol = symbol != null ? symbol : DEFAULT_SYMBOL;
        metadata = metadata != null ? Collections.unmodifiableMap(metadata) : Map.of();
    }

    public static Signal longSignal(long timestamp, String symbol, double size) {
        return new Signal(timestamp, symbol, SignalDirection.LONG, 1.0, size, null);
    }

    public static Signal shortSignal(long timestamp, String symbol, double size) {
        return new Signal(timestamp, symbol, SignalDirection.SHORT, 1.0, size, null);
    }

    public static Signal flat(long timestamp, String symbol) {
        return new Signal(timestamp, symbol, SignalDirection.FLAT, 1.0, 0, null);
    }

    /**
     * Copy of this signal addressed to another symbol.
     */
    public Signal withSymbol(String newSymbol) {
        return new Signal(timestamp, newSymbol, direction, strength, size, metadata);
    }

    @JsonIgnore
    public boolean isDefaultSymbol() {
        return DEFAULT_SYMBOL.equals(symbol);
    }

    @JsonIgnore
    public boolean isLong() {
        return direction == SignalDirection.LONG;
    }

    @JsonIgnore
    public boolean isShort() {
        return direction == SignalDirection.SHORT;
    }

    @JsonIgnore
    public boolean hasExplicitSize() {
        return size > 0;
    }
}
