package com.tickline.core.journal;

/**
 * Journal event for position lifecycle (opened, increased, closed).
 */
public class PositionEvent extends ExecutionEvent {

    private String action; // opened, increased, closed
    private String symbol;
    private double quantity;
    private double avgPrice;
    private Double exitPrice;
    private Double realizedPnl;

    // For Jackson
    public PositionEvent() {}

    private PositionEvent(String action, long timestamp, String symbol, double quantity, double avgPrice) {
        super(timestamp);
        this.action = action;
        this.symbol = symbol;
        this.quantity = quantity;
        this.avgPrice = avgPrice;
    }

    public static PositionEvent opened(long timestamp, String symbol, double quantity, double avgPrice) {
        return new PositionEvent("opened", timestamp, symbol, quantity, avgPrice);
    }

    public static PositionEvent increased(long timestamp, String symbol, double quantity, double avgPrice) {
        return new PositionEvent("increased", timestamp, symbol, quantity, avgPrice);
    }

    public static PositionEvent closed(long timestamp, String symbol, double quantity, double avgPrice,
                                       double exitPrice, double netPnl) {
        PositionEvent event = new PositionEvent("closed", timestamp, symbol, quantity, avgPrice);
        event.exitPrice = exitPrice;
        event.realizedPnl = netPnl;
        return event;
    }

    @Override
    public String getEventType() { return "position"; }

    @Override
    public String getSummary() {
        if ("closed".equals(action)) {
            return String.format("[%s] %s %.4f PnL=%.2f", action, symbol, quantity, realizedPnl);
        }
        return String.format("[%s] %s %.4f @ %.4f", action, symbol, quantity, avgPrice);
    }

    // Getters for Jackson
    public String getAction() { return action; }
    public String getSymbol() { return symbol; }
    public double getQuantity() { return quantity; }
    public double getAvgPrice() { return avgPrice; }
    public Double getExitPrice() { return exitPrice; }
    public Double getRealizedPnl() { return realizedPnl; }
}
