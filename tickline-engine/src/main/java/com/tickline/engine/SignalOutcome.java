package com.tickline.engine;

import com.tickline.core.model.Signal;

import java.util.List;
import java.util.Objects;

/**
 * Result of asking the strategy for signals on one symbol at one step:
 * either the signals it returned or the error it raised.
 */
public record SignalOutcome(
    String symbol,
    long timestamp,
    List<Signal> signals,
    String error
) {
    /**
     * Null entries in the returned list are ignored.
     */
    public static SignalOutcome ok(String symbol, long timestamp, List<Signal> signals) {
        return new SignalOutcome(symbol, timestamp, signals != null
            ? signals.stream().filter(Objects::nonNull).toList()
            : List.of(), null);
    }

    public static SignalOutcome failed(String symbol, long timestamp, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new SignalOutcome(symbol, timestamp, List.of(),
            "Strategy failed for " + symbol + " at " + timestamp + ": " + message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
