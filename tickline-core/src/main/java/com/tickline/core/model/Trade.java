package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A completed round trip: one position from its first opening fill to its closing fill.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    String symbol,
    SignalDirection direction,  // LONG or SHORT
    double quantity,            // absolute share count
    double entryPrice,          // average entry price
    double exitPrice,
    long entryTime,
    long exitTime,
    double commission,          // commission charged on the closing fill
    double slippageCost,
    double netPnl               // gross - commission - slippageCost
) {
    /**
     * Gross P&L before costs.
     */
    @JsonIgnore
    public double grossPnl() {
        return netPnl + commission + slippageCost;
    }

    @JsonIgnore
    public long holdingMillis() {
        return exitTime - entryTime;
    }

    @JsonIgnore
    public boolean isWinner() {
        return netPnl > 0;
    }

    @JsonIgnore
    public boolean isLong() {
        return direction == SignalDirection.LONG;
    }
}
