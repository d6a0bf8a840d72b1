package com.tickline.engine;

import com.tickline.core.model.PositionSnapshot;
import com.tickline.core.model.SignalDirection;

/**
 * Open position in one symbol. Quantity is signed: negative for shorts.
 * Only the {@link PositionLedger} creates and mutates positions.
 */
public class Position {

    private final String symbol;
    private final long entryTime;
    private double quantity;
    private double avgPrice;
    private double lastPrice;       // latest mark, starts at the fill price
    private double unrealizedPnl;

    Position(String symbol, double quantity, double avgPrice, long entryTime) {
        this.symbol = symbol;
        this.quantity = quantity;
        this.avgPrice = avgPrice;
        this.entryTime = entryTime;
        this.lastPrice = avgPrice;
    }

    /**
     * Add same-direction shares, averaging the entry price by quantity.
     */
    void add(double signedShares, double fillPrice) {
        double total = quantity + signedShares;
        avgPrice = (avgPrice * Math.abs(quantity) + fillPrice * Math.abs(signedShares)) / Math.abs(total);
        quantity = total;
        markToMarket(lastPrice);
    }

    /**
     * Revalue at the given price.
     */
    void markToMarket(double price) {
        lastPrice = price;
        if (quantity > 0) {
            unrealizedPnl = quantity * (price - avgPrice);
        } else {
            unrealizedPnl = Math.abs(quantity) * (avgPrice - price);
        }
    }

    /**
     * Gross P&L of closing the whole position at the given price.
     */
    public double grossPnlAt(double exitPrice) {
        if (isLong()) {
            return quantity * (exitPrice - avgPrice);
        }
        return Math.abs(quantity) * (avgPrice - exitPrice);
    }

    /**
     * Capital committed at entry: |quantity| x average price.
     */
    public double costBasis() {
        return Math.abs(quantity) * avgPrice;
    }

    public boolean isLong() {
        return quantity > 0;
    }

    public boolean isShort() {
        return quantity < 0;
    }

    public SignalDirection direction() {
        return isLong() ? SignalDirection.LONG : SignalDirection.SHORT;
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(symbol, quantity, avgPrice, entryTime);
    }

    // Getters
    public String getSymbol() { return symbol; }
    public double getQuantity() { return quantity; }
    public double getAvgPrice() { return avgPrice; }
    public long getEntryTime() { return entryTime; }
    public double getLastPrice() { return lastPrice; }
    public double getUnrealizedPnl() { return unrealizedPnl; }
}
