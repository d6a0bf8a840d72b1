package com.tickline.engine;

import com.tickline.core.journal.OrderEvent;
import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.OrderAction;
import com.tickline.core.model.Signal;
import com.tickline.core.model.SignalDirection;
import com.tickline.engine.journal.ExecutionJournal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalAdapterTest {

    private Portfolio portfolio;
    private ExecutionJournal journal;
    private SignalAdapter adapter;

    @BeforeEach
    void setUp() {
        BacktestConfig config = BacktestConfig.frictionless(10000).withMaxPositionPct(0.5);
        portfolio = new Portfolio(config.initialCapital());
        journal = new ExecutionJournal();
        adapter = new SignalAdapter(config, portfolio, journal);
    }

    @Test
    @DisplayName("FLAT without a position queues nothing")
    void flatWithoutPosition() {
        assertTrue(adapter.translate(Signal.flat(1, "AAPL"), 1).isEmpty());
        assertEquals(0, journal.size());
    }

    @Test
    @DisplayName("FLAT with a position queues a close")
    void flatClosesPosition() {
        portfolio.getLedger().applyOpeningFill("AAPL", 1, 100, 0);

        List<PendingOrder> orders = adapter.translate(Signal.flat(1, "AAPL"), 1);

        assertEquals(1, orders.size());
        assertTrue(orders.get(0).isClose());
        assertEquals(1, journal.getOrderEvents(OrderEvent.Type.QUEUED).size());
    }

    @Test
    @DisplayName("LONG against an open short closes first, then opens")
    void longReversesShort() {
        portfolio.getLedger().applyOpeningFill("AAPL", -1, 100, 0);

        List<PendingOrder> orders = adapter.translate(Signal.longSignal(1, "AAPL", 2000), 1);

        assertEquals(2, orders.size());
        assertEquals(OrderAction.CLOSE, orders.get(0).action());
        assertEquals(OrderAction.OPEN_LONG, orders.get(1).action());
        assertEquals(2000, orders.get(1).size());
    }

    @Test
    @DisplayName("SHORT against an open long closes first, then opens")
    void shortReversesLong() {
        portfolio.getLedger().applyOpeningFill("AAPL", 1, 100, 0);

        List<PendingOrder> orders = adapter.translate(Signal.shortSignal(1, "AAPL", 500), 1);

        assertEquals(List.of(OrderAction.CLOSE, OrderAction.OPEN_SHORT),
            orders.stream().map(PendingOrder::action).toList());
    }

    @Test
    @DisplayName("Unsized signal deploys equity x maxPositionPct x strength")
    void engineSizing() {
        Signal signal = new Signal(1, "AAPL", SignalDirection.LONG, 0.4, 0, null);

        List<PendingOrder> orders = adapter.translate(signal, 1);

        assertEquals(10000 * 0.5 * 0.4, orders.get(0).size(), 1e-9);
    }

    @Test
    @DisplayName("Zero strength queues no open order")
    void zeroStrength() {
        Signal signal = new Signal(1, "AAPL", SignalDirection.SHORT, 0, 0, null);

        assertTrue(adapter.translate(signal, 1).isEmpty());
    }
}
