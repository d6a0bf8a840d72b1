package com.tickline.core.journal;

import com.tickline.core.model.OrderAction;

/**
 * Journal event for order lifecycle (queued, filled, resized, dropped, deferred, close skipped).
 */
public class OrderEvent extends ExecutionEvent {

    public enum Type {
        QUEUED,
        FILLED,
        /** Open order shrunk to the largest affordable share count. */
        RESIZED,
        /** Open order discarded: nothing affordable, zero shares, or an opposite position is open. */
        DROPPED,
        /** Symbol had no bar at the executing timestamp; order stays queued. */
        DEFERRED,
        /** Close order found no position. */
        CLOSE_SKIPPED
    }

    private Type type;
    private String symbol;
    private OrderAction action;
    private long queuedAt;
    private double requestedSize;
    private Double shares;
    private Double fillPrice;
    private Double commission;
    private String reason;

    // For Jackson
    public OrderEvent() {}

    private OrderEvent(Type type, long timestamp, String symbol, OrderAction action,
                       long queuedAt, double requestedSize) {
        super(timestamp);
        this.type = type;
        this.symbol = symbol;
        this.action = action;
        this.queuedAt = queuedAt;
        this.requestedSize = requestedSize;
    }

    public static OrderEvent queued(long timestamp, String symbol, OrderAction action, double size) {
        return new OrderEvent(Type.QUEUED, timestamp, symbol, action, timestamp, size);
    }

    public static OrderEvent filled(long timestamp, String symbol, OrderAction action, long queuedAt,
                                    double requestedSize, double shares, double fillPrice, double commission) {
        OrderEvent event = new OrderEvent(Type.FILLED, timestamp, symbol, action, queuedAt, requestedSize);
        event.shares = shares;
        event.fillPrice = fillPrice;
        event.commission = commission;
        return event;
    }

    public static OrderEvent resized(long timestamp, String symbol, OrderAction action, long queuedAt,
                                     double requestedSize, double desiredShares, double affordableShares) {
        OrderEvent event = new OrderEvent(Type.RESIZED, timestamp, symbol, action, queuedAt, requestedSize);
        event.shares = affordableShares;
        event.reason = String.format("insufficient cash: %.4f -> %.4f shares", desiredShares, affordableShares);
        return event;
    }

    public static OrderEvent dropped(long timestamp, String symbol, OrderAction action, long queuedAt,
                                     double requestedSize, String reason) {
        OrderEvent event = new OrderEvent(Type.DROPPED, timestamp, symbol, action, queuedAt, requestedSize);
        event.reason = reason;
        return event;
    }

    public static OrderEvent deferred(long timestamp, String symbol, OrderAction action, long queuedAt,
                                      double requestedSize) {
        return new OrderEvent(Type.DEFERRED, timestamp, symbol, action, queuedAt, requestedSize);
    }

    public static OrderEvent closeSkipped(long timestamp, String symbol, long queuedAt) {
        OrderEvent event = new OrderEvent(Type.CLOSE_SKIPPED, timestamp, symbol, OrderAction.CLOSE, queuedAt, 0);
        event.reason = "no open position";
        return event;
    }

    @Override
    public String getEventType() { return "order"; }

    @Override
    public String getSummary() {
        if (fillPrice != null) {
            return String.format("[%s] %s %s %.4f @ %.4f", type, action, symbol, shares, fillPrice);
        }
        return String.format("[%s] %s %s size=%.2f%s", type, action, symbol, requestedSize,
                reason != null ? " (" + reason + ")" : "");
    }

    // Getters for Jackson
    public Type getType() { return type; }
    public String getSymbol() { return symbol; }
    public OrderAction getAction() { return action; }
    public long getQueuedAt() { return queuedAt; }
    public double getRequestedSize() { return requestedSize; }
    public Double getShares() { return shares; }
    public Double getFillPrice() { return fillPrice; }
    public Double getCommission() { return commission; }
    public String getReason() { return reason; }
}
