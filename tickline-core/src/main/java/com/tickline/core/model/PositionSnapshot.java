package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Frozen copy of an open position, taken when an equity sample is recorded.
 * Quantity is signed: negative for shorts.
 */
public record PositionSnapshot(
    String symbol,
    double quantity,
    double avgPrice,
    long entryTime
) {
    @JsonIgnore
    public boolean isLong() {
        return quantity > 0;
    }

    @JsonIgnore
    public boolean isShort() {
        return quantity < 0;
    }
}
