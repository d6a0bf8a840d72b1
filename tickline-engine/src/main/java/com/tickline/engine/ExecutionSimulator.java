package com.tickline.engine;

import com.tickline.core.journal.OrderEvent;
import com.tickline.core.journal.PositionEvent;
import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.Bar;
import com.tickline.core.model.OrderAction;
import com.tickline.core.model.Trade;
import com.tickline.engine.journal.ExecutionJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Fills pending orders against a bar, mutating the run's cash and ledger.
 *
 * All fills happen at the bar's open. Opening buys pay open x (1 + bps/10000),
 * opening sells receive open / (1 + bps/10000); closes fill at the raw open and
 * carry their slippage as a cost on the recorded trade.
 */
public class ExecutionSimulator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSimulator.class);

    static final String REASON_ZERO_SHARES = "size buys zero shares";
    static final String REASON_INSUFFICIENT_CASH = "insufficient cash";
    static final String REASON_OPPOSITE_POSITION = "opposite position open";

    private final BacktestConfig config;
    private final Portfolio portfolio;
    private final ExecutionJournal journal;

    public ExecutionSimulator(BacktestConfig config, Portfolio portfolio, ExecutionJournal journal) {
        this.config = config;
        this.portfolio = portfolio;
        this.journal = journal;
    }

    /**
     * Execute one order against the current bar of its symbol.
     *
     * @return the completed trade when the order closed a position
     */
    public Optional<Trade> execute(PendingOrder order, Bar bar, long timestamp) {
        if (order.isClose()) {
            return close(order, bar, timestamp);
        }
        open(order, bar, timestamp);
        return Optional.empty();
    }

    /**
     * Fill price for an action at the given open.
     */
    public double fillPrice(OrderAction action, double open) {
        return switch (action) {
            case OPEN_LONG -> open * config.slippageMultiplier();
            case OPEN_SHORT -> open / config.slippageMultiplier();
            case CLOSE -> open;
        };
    }

    private Optional<Trade> close(PendingOrder order, Bar bar, long timestamp) {
        String symbol = order.symbol();
        Optional<Position> existing = portfolio.getLedger().get(symbol);
        if (existing.isEmpty()) {
            log.debug("No position to close for {} at {}", symbol, timestamp);
            journal.log(OrderEvent.closeSkipped(timestamp, symbol, order.queuedAt()));
            return Optional.empty();
        }

        Position position = existing.get();
        double fillPrice = fillPrice(OrderAction.CLOSE, bar.open());
        double shares = Math.abs(position.getQuantity());

        double grossPnl = position.grossPnlAt(fillPrice);
        double commission = shares * config.commissionPerShare();
        double slippageCost = shares * fillPrice * (config.slippageBps() / 10000.0);
        double netPnl = grossPnl - commission - slippageCost;

        portfolio.credit(position.costBasis() + grossPnl - commission);
        portfolio.getLedger().remove(symbol);

        Trade trade = new Trade(
            symbol,
            position.direction(),
            shares,
            position.getAvgPrice(),
            fillPrice,
            position.getEntryTime(),
            timestamp,
            commission,
            slippageCost,
            netPnl
        );

        journal.log(OrderEvent.filled(timestamp, symbol, OrderAction.CLOSE, order.queuedAt(),
            0, shares, fillPrice, commission));
        journal.log(PositionEvent.closed(timestamp, symbol, position.getQuantity(),
            position.getAvgPrice(), fillPrice, netPnl));
        log.debug("Closed {} {} x {} @ {} (entry {}), net PnL {}",
            position.direction(), symbol, shares, fillPrice, position.getAvgPrice(), netPnl);
        return Optional.of(trade);
    }

    private void open(PendingOrder order, Bar bar, long timestamp) {
        String symbol = order.symbol();
        OrderAction action = order.action();
        double size = order.size();
        double fillPrice = fillPrice(action, bar.open());
        PositionLedger ledger = portfolio.getLedger();

        boolean opposite = action == OrderAction.OPEN_LONG ? ledger.isShort(symbol) : ledger.isLong(symbol);
        if (opposite) {
            drop(order, timestamp, REASON_OPPOSITE_POSITION);
            return;
        }

        double shares = toShares(size / fillPrice);
        if (shares <= 0) {
            drop(order, timestamp, REASON_ZERO_SHARES);
            return;
        }

        double commission = shares * config.commissionPerShare();
        double notional = Math.min(shares * fillPrice, size);
        double cash = portfolio.getCash();

        if (size + commission > cash) {
            double available = cash - commission;
            if (available <= 0) {
                drop(order, timestamp, REASON_INSUFFICIENT_CASH);
                return;
            }
            double desired = shares;
            shares = toShares(available / fillPrice);
            if (shares <= 0) {
                drop(order, timestamp, REASON_INSUFFICIENT_CASH);
                return;
            }
            commission = shares * config.commissionPerShare();
            // Clamp against rounding so the debit never exceeds what was affordable
            notional = Math.min(shares * fillPrice, available);
            journal.log(OrderEvent.resized(timestamp, symbol, action, order.queuedAt(), size, desired, shares));
            log.info("Resized {} {} at {}: {} -> {} shares (cash {})",
                action, symbol, timestamp, desired, shares, cash);
        }

        portfolio.debit(notional + commission);

        double signedShares = action == OrderAction.OPEN_SHORT ? -shares : shares;
        boolean adding = ledger.hasPosition(symbol);
        Position position = ledger.applyOpeningFill(symbol, signedShares, fillPrice, timestamp);

        journal.log(OrderEvent.filled(timestamp, symbol, action, order.queuedAt(), size, shares, fillPrice, commission));
        if (adding) {
            journal.log(PositionEvent.increased(timestamp, symbol, position.getQuantity(), position.getAvgPrice()));
        } else {
            journal.log(PositionEvent.opened(timestamp, symbol, position.getQuantity(), position.getAvgPrice()));
        }
        log.debug("Filled {} {} x {} @ {}, commission {}, cash now {}",
            action, symbol, shares, fillPrice, commission, portfolio.getCash());
    }

    private double toShares(double rawShares) {
        return config.allowFractionalShares() ? rawShares : Math.floor(rawShares);
    }

    private void drop(PendingOrder order, long timestamp, String reason) {
        journal.log(OrderEvent.dropped(timestamp, order.symbol(), order.action(), order.queuedAt(), order.size(), reason));
        log.info("Dropped {} {} size {} at {}: {}", order.action(), order.symbol(), order.size(), timestamp, reason);
    }
}
