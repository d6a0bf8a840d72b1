package com.tickline.engine;

import com.tickline.core.journal.OrderEvent;
import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.Bar;
import com.tickline.core.model.OrderAction;
import com.tickline.core.model.Signal;
import com.tickline.core.model.SignalDirection;
import com.tickline.core.model.Trade;
import com.tickline.engine.journal.ExecutionJournal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionSimulatorTest {

    private Portfolio portfolio;
    private ExecutionJournal journal;

    private ExecutionSimulator simulator(BacktestConfig config) {
        portfolio = new Portfolio(config.initialCapital());
        journal = new ExecutionJournal();
        return new ExecutionSimulator(config, portfolio, journal);
    }

    private static PendingOrder openLong(double size) {
        return PendingOrder.open("AAPL", OrderAction.OPEN_LONG, size, Signal.longSignal(0, "AAPL", size), 0);
    }

    private static PendingOrder openShort(double size) {
        return PendingOrder.open("AAPL", OrderAction.OPEN_SHORT, size, Signal.shortSignal(0, "AAPL", size), 0);
    }

    private static PendingOrder close() {
        return PendingOrder.close("AAPL", Signal.flat(0, "AAPL"), 0);
    }

    @Nested
    @DisplayName("Fill prices")
    class FillPrices {

        @Test
        @DisplayName("Buys pay open x (1 + bps), sells receive open / (1 + bps), closes fill at the open")
        void slippageDirection() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(100000).withCosts(0.01, 10));

            assertEquals(100 * 1.001, sim.fillPrice(OrderAction.OPEN_LONG, 100), 1e-12);
            assertEquals(100 / 1.001, sim.fillPrice(OrderAction.OPEN_SHORT, 100), 1e-12);
            assertEquals(100, sim.fillPrice(OrderAction.CLOSE, 100));
        }
    }

    @Nested
    @DisplayName("Opening orders")
    class OpeningOrders {

        @Test
        @DisplayName("Opening orders require a finite positive size")
        void rejectsNonFiniteSize() {
            Signal signal = Signal.longSignal(0, "AAPL", 0);
            assertThrows(IllegalArgumentException.class,
                () -> new PendingOrder("AAPL", OrderAction.OPEN_LONG, Double.POSITIVE_INFINITY, signal, 0));
            assertThrows(IllegalArgumentException.class,
                () -> PendingOrder.open("AAPL", OrderAction.OPEN_SHORT, 0, signal, 0));
            assertEquals(0, PendingOrder.close("AAPL", signal, 0).size());
        }

        @Test
        @DisplayName("Affordable buy debits notional plus commission")
        void affordableBuy() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(10000).withCosts(0.01, 0));

            sim.execute(openLong(1000), Bar.flat(1, 100), 1);

            Position position = portfolio.getLedger().get("AAPL").orElseThrow();
            assertEquals(10, position.getQuantity(), 1e-12);
            assertEquals(100, position.getAvgPrice());
            assertEquals(10000 - 1000 - 0.1, portfolio.getCash(), 1e-9);
            assertEquals(1, journal.getOrderEvents(OrderEvent.Type.FILLED).size());
        }

        @Test
        @DisplayName("Unaffordable buy shrinks to the maximum affordable size")
        void shrinksToAffordable() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(1000).withCosts(0.01, 0));

            sim.execute(openLong(5000), Bar.flat(1, 100), 1);

            double commissionAtDesired = 50 * 0.01;
            double expectedShares = (1000 - commissionAtDesired) / 100;
            Position position = portfolio.getLedger().get("AAPL").orElseThrow();
            assertEquals(expectedShares, position.getQuantity(), 1e-9);
            assertTrue(portfolio.getCash() >= 0);
            assertEquals(1, journal.getOrderEvents(OrderEvent.Type.RESIZED).size());
        }

        @Test
        @DisplayName("Whole-share mode floors and drops orders that buy nothing")
        void wholeShares() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(10000).withFractionalShares(false));

            sim.execute(openLong(250), Bar.flat(1, 100), 1);
            assertEquals(2, portfolio.getLedger().get("AAPL").orElseThrow().getQuantity());
            assertEquals(10000 - 200, portfolio.getCash(), 1e-9);

            sim.execute(openLong(50), Bar.flat(2, 100), 2);
            List<OrderEvent> dropped = journal.getOrderEvents(OrderEvent.Type.DROPPED);
            assertEquals(1, dropped.size());
            assertEquals(ExecutionSimulator.REASON_ZERO_SHARES, dropped.get(0).getReason());
        }

        @Test
        @DisplayName("Drops a buy when commission alone exceeds cash")
        void dropsWhenNothingAffordable() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(1).withCosts(1, 0));

            sim.execute(openLong(1000), Bar.flat(1, 1), 1);

            assertTrue(portfolio.getLedger().isEmpty());
            assertEquals(1, portfolio.getCash());
            assertEquals(ExecutionSimulator.REASON_INSUFFICIENT_CASH,
                journal.getOrderEvents(OrderEvent.Type.DROPPED).get(0).getReason());
        }

        @Test
        @DisplayName("Opposite-direction open is dropped, never netted")
        void oppositeDirectionDropped() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(10000));
            sim.execute(openLong(1000), Bar.flat(1, 100), 1);
            double cash = portfolio.getCash();

            sim.execute(openShort(500), Bar.flat(2, 100), 2);

            assertTrue(portfolio.getLedger().isLong("AAPL"));
            assertEquals(cash, portfolio.getCash());
            assertEquals(ExecutionSimulator.REASON_OPPOSITE_POSITION,
                journal.getOrderEvents(OrderEvent.Type.DROPPED).get(0).getReason());
        }
    }

    @Nested
    @DisplayName("Closing orders")
    class ClosingOrders {

        @Test
        @DisplayName("Close without a position changes nothing")
        void closeWithoutPosition() {
            ExecutionSimulator sim = simulator(BacktestConfig.defaults());

            Optional<Trade> trade = sim.execute(close(), Bar.flat(1, 100), 1);

            assertTrue(trade.isEmpty());
            assertEquals(100000, portfolio.getCash());
            assertEquals(1, journal.getOrderEvents(OrderEvent.Type.CLOSE_SKIPPED).size());
        }

        @Test
        @DisplayName("Closing a long records costs and credits cost basis plus gross minus commission")
        void closeLong() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(10000).withCosts(0.01, 10));
            sim.execute(openLong(1000), Bar.flat(1, 100), 1);
            Position position = portfolio.getLedger().get("AAPL").orElseThrow();
            double qty = position.getQuantity();
            double entry = position.getAvgPrice();
            double cashBefore = portfolio.getCash();

            Trade trade = sim.execute(close(), Bar.flat(2, 110), 2).orElseThrow();

            double gross = qty * (110 - entry);
            double commission = qty * 0.01;
            double slippage = qty * 110 * 0.001;
            assertEquals(SignalDirection.LONG, trade.direction());
            assertEquals(110, trade.exitPrice());
            assertEquals(entry, trade.entryPrice());
            assertEquals(commission, trade.commission(), 1e-12);
            assertEquals(slippage, trade.slippageCost(), 1e-12);
            assertEquals(gross - commission - slippage, trade.netPnl(), 1e-9);
            assertEquals(cashBefore + qty * entry + gross - commission, portfolio.getCash(), 1e-9);
            assertTrue(portfolio.getLedger().isEmpty());
        }

        @Test
        @DisplayName("Closing a short profits when price falls")
        void closeShort() {
            ExecutionSimulator sim = simulator(BacktestConfig.frictionless(10000));
            sim.execute(openShort(1000), Bar.flat(1, 100), 1);

            Trade trade = sim.execute(close(), Bar.flat(2, 90), 2).orElseThrow();

            assertEquals(SignalDirection.SHORT, trade.direction());
            assertEquals(10, trade.quantity(), 1e-12);
            assertEquals(100, trade.netPnl(), 1e-9);
            assertEquals(10100, portfolio.getCash(), 1e-9);
        }
    }
}
