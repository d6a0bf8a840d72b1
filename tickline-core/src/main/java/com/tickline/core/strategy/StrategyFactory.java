package com.tickline.core.strategy;

/**
 * Creates a fresh strategy instance for each independent run.
 */
@FunctionalInterface
public interface StrategyFactory {

    Strategy create();
}
