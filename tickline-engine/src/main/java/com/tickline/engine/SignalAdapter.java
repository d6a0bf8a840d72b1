package com.tickline.engine;

import com.tickline.core.journal.OrderEvent;
import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.OrderAction;
import com.tickline.core.model.Signal;
import com.tickline.engine.journal.ExecutionJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns strategy signals into pending orders.
 *
 * FLAT closes an open position. LONG closes an open short, then opens or adds
 * to a long; SHORT is the mirror image. Orders are decided against the ledger
 * as it stands when the signal arrives, not against orders still queued.
 */
public class SignalAdapter {

    private static final Logger log = LoggerFactory.getLogger(SignalAdapter.class);

    private final BacktestConfig config;
    private final Portfolio portfolio;
    private final ExecutionJournal journal;

    public SignalAdapter(BacktestConfig config, Portfolio portfolio, ExecutionJournal journal) {
        this.config = config;
        this.portfolio = portfolio;
        this.journal = journal;
    }

    /**
     * Orders for one signal, in the order they must execute.
     *
     * @param signal    signal already addressed to a concrete symbol
     * @param timestamp step at which the orders are queued
     */
    public List<PendingOrder> translate(Signal signal, long timestamp) {
        String symbol = signal.symbol();
        PositionLedger ledger = portfolio.getLedger();
        List<PendingOrder> orders = new ArrayList<>(2);

        switch (signal.direction()) {
            case FLAT -> {
                if (ledger.hasPosition(symbol)) {
                    orders.add(PendingOrder.close(symbol, signal, timestamp));
                }
            }
            case LONG -> {
                if (ledger.isShort(symbol)) {
                    orders.add(PendingOrder.close(symbol, signal, timestamp));
                }
                addOpen(orders, signal, OrderAction.OPEN_LONG, timestamp);
            }
            case SHORT -> {
                if (ledger.isLong(symbol)) {
                    orders.add(PendingOrder.close(symbol, signal, timestamp));
                }
                addOpen(orders, signal, OrderAction.OPEN_SHORT, timestamp);
            }
        }

        for (PendingOrder order : orders) {
            journal.log(OrderEvent.queued(timestamp, symbol, order.action(), order.size()));
        }
        return orders;
    }

    /**
     * Currency amount an opening order deploys: the signal's own size when set,
     * otherwise equity x maxPositionPct x strength.
     */
    double positionSize(Signal signal) {
        if (signal.hasExplicitSize()) {
            return signal.size();
        }
        return portfolio.equity() * config.maxPositionPct() * signal.strength();
    }

    private void addOpen(List<PendingOrder> orders, Signal signal, OrderAction action, long timestamp) {
        double size = positionSize(signal);
        if (!(size > 0)) {
            log.debug("No {} order for {} at {}: computed size {}", action, signal.symbol(), timestamp, size);
            return;
        }
        orders.add(PendingOrder.open(signal.symbol(), action, size, signal, timestamp));
    }
}
