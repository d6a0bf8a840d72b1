package com.tickline.core.strategy;

/**
 * Raised by a strategy that cannot evaluate a bar.
 */
public class StrategyException extends Exception {

    public StrategyException(String message) {
        super(message);
    }

    public StrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
