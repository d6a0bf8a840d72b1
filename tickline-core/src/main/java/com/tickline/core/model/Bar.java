package com.tickline.core.model;

/**
 * OHLCV bar for one symbol at one timestamp.
 * Timestamps are epoch milliseconds.
 */
public record Bar(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    /**
     * Bar with all four prices equal, handy for flat fixtures.
     */
    public static Bar flat(long timestamp, double price) {
        return new Bar(timestamp, price, price, price, price, 0);
    }
}
