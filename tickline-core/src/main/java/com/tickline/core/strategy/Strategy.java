package com.tickline.core.strategy;

import com.tickline.core.model.FeatureWindow;
import com.tickline.core.model.Signal;

import java.util.List;

/**
 * Signal source evaluated once per symbol per timestamp.
 *
 * Implementations must be deterministic for reproducible runs: given the same
 * windows in the same order they should return the same signals. An instance
 * is only ever called from the thread running its backtest.
 */
@FunctionalInterface
public interface Strategy {

    /**
     * Generate signals for the symbol at the end of the window.
     *
     * @param window    trailing bars and features of the symbol, ending at {@code timestamp}
     * @param timestamp the bar being evaluated (epoch millis)
     * @param state     precomputed state vector aligned with this bar, or null when none was supplied
     * @return signals to act on; empty when there is nothing to do
     * @throws StrategyException when the strategy cannot evaluate this bar; the engine logs it
     *                           and moves on to the next symbol
     */
    List<Signal> generateSignals(FeatureWindow window, long timestamp, double[] state) throws StrategyException;

    /**
     * Human-readable name for logs.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
