package com.tickline.engine;

import com.tickline.core.model.Bar;

import java.util.Map;

/**
 * Cash and open positions of a single run. Each run owns its own instance;
 * nothing here is shared between runs.
 */
public class Portfolio {

    private final PositionLedger ledger = new PositionLedger();
    private double cash;

    public Portfolio(double initialCash) {
        this.cash = initialCash;
    }

    public double getCash() {
        return cash;
    }

    public PositionLedger getLedger() {
        return ledger;
    }

    void debit(double amount) {
        cash -= amount;
    }

    void credit(double amount) {
        cash += amount;
    }

    /**
     * Revalue every position that has a bar at this step at the bar's close.
     * Positions without a bar keep their previous mark.
     */
    void markToMarket(Map<String, Bar> bars) {
        for (Position position : ledger.getOpenPositions()) {
            Bar bar = bars.get(position.getSymbol());
            if (bar != null) {
                ledger.markToMarket(position.getSymbol(), bar.close());
            }
        }
    }

    /**
     * Portfolio equity at the positions' latest marks:
     * cash + sum(long: qty * price) + sum(short: qty * price + 2 * qty * avgPrice), qty signed.
     */
    public double equity() {
        double equity = cash;
        for (Position position : ledger.getOpenPositions()) {
            equity += markValue(position, position.getLastPrice());
        }
        return equity;
    }

    /**
     * Contribution of one position to equity at the given price.
     */
    static double markValue(Position position, double price) {
        double qty = position.getQuantity();
        if (qty > 0) {
            return qty * price;
        }
        // Short leg kept in this exact form; see DESIGN.md open questions
        return qty * price + 2 * qty * position.getAvgPrice();
    }
}
