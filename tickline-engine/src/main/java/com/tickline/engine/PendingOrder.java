package com.tickline.engine;

import com.tickline.core.model.OrderAction;
import com.tickline.core.model.Signal;

/**
 * Order waiting for execution. Created by the {@link SignalAdapter},
 * consumed exactly once by the {@link ExecutionSimulator}.
 *
 * @param symbol   target symbol
 * @param action   open long, open short, or close
 * @param size     currency amount to deploy for opens, 0 for closes
 * @param signal   signal that produced this order
 * @param queuedAt timestamp of the step that queued it
 */
public record PendingOrder(
    String symbol,
    OrderAction action,
    double size,
    Signal signal,
    long queuedAt
) {
    public PendingOrder {
        if (action.isOpen() && !(size > 0 && Double.isFinite(size))) {
            throw new IllegalArgumentException("Opening order size must be finite and > 0: " + size);
        }
    }

    public static PendingOrder close(String symbol, Signal signal, long queuedAt) {
        return new PendingOrder(symbol, OrderAction.CLOSE, 0, signal, queuedAt);
    }

    public static PendingOrder open(String symbol, OrderAction action, double size, Signal signal, long queuedAt) {
        if (!action.isOpen()) {
            throw new IllegalArgumentException("Not an opening action: " + action);
        }
        return new PendingOrder(symbol, action, size, signal, queuedAt);
    }

    public boolean isClose() {
        return action == OrderAction.CLOSE;
    }
}
