package com.tickline.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMetricsTest {

    private static final long HOUR = 3600000L;

    private static BacktestResult result(double[] equity, List<Trade> trades) {
        SortedMap<Long, Double> curve = new TreeMap<>();
        for (int i = 0; i < equity.length; i++) {
            curve.put(i * HOUR, equity[i]);
        }
        double last = equity.length > 0 ? equity[equity.length - 1] : 10000;
        return new BacktestResult("test", BacktestConfig.frictionless(10000), curve, List.of(), trades,
            List.of(), List.of(), List.of(), last, Map.of(), List.of("AAPL"), equity.length, 0, 0, 0);
    }

    private static Trade trade(double netPnl, long holdHours) {
        return new Trade("AAPL", SignalDirection.LONG, 10, 100, 100 + netPnl / 10, 0, holdHours * HOUR,
            0, 0, netPnl);
    }

    @Test
    @DisplayName("Empty result gives zeroed metrics at initial capital")
    void emptyResult() {
        PerformanceMetrics metrics = PerformanceMetrics.calculate(result(new double[0], List.of()));

        assertEquals(0, metrics.totalTrades());
        assertEquals(0, metrics.sharpeRatio());
        assertEquals(10000, metrics.finalEquity());
    }

    @Test
    @DisplayName("Trade statistics")
    void tradeStatistics() {
        List<Trade> trades = List.of(trade(300, 2), trade(-100, 4), trade(100, 6));

        PerformanceMetrics metrics = PerformanceMetrics.calculate(
            result(new double[]{10000, 10300, 10200, 10300}, trades));

        assertEquals(3, metrics.totalTrades());
        assertEquals(2, metrics.winningTrades());
        assertEquals(1, metrics.losingTrades());
        assertEquals(200.0 / 3, metrics.winRate(), 1e-9);
        assertEquals(4.0, metrics.profitFactor(), 1e-9);
        assertEquals(300, metrics.netProfit(), 1e-9);
        assertEquals(200, metrics.averageWin(), 1e-9);
        assertEquals(100, metrics.averageLoss(), 1e-9);
        assertEquals(300, metrics.largestWin(), 1e-9);
        assertEquals(4.0, metrics.averageHoldingHours(), 1e-9);
        assertEquals(0.03, metrics.totalReturn(), 1e-12);
    }

    @Test
    @DisplayName("Drawdown depth and duration")
    void drawdown() {
        PerformanceMetrics metrics = PerformanceMetrics.calculate(
            result(new double[]{10000, 12000, 9000, 10000, 11000, 12500}, List.of()));

        assertEquals(0.25, metrics.maxDrawdown(), 1e-12);
        assertEquals(3, metrics.maxDrawdownDuration());
    }

    @Test
    @DisplayName("Constant equity has zero volatility and zero Sharpe")
    void flatEquity() {
        PerformanceMetrics metrics = PerformanceMetrics.calculate(
            result(new double[]{10000, 10000, 10000, 10000}, List.of()));

        assertEquals(0, metrics.volatility());
        assertEquals(0, metrics.sharpeRatio());
        assertEquals(0, metrics.sortinoRatio());
        assertEquals(0, metrics.maxDrawdown());
    }

    @Test
    @DisplayName("Steadily rising equity has a positive Sharpe ratio")
    void risingEquity() {
        PerformanceMetrics metrics = PerformanceMetrics.calculate(
            result(new double[]{10000, 10100, 10150, 10300, 10320, 10500}, List.of()));

        assertTrue(metrics.sharpeRatio() > 0);
        assertTrue(metrics.volatility() > 0);
        assertEquals(0, metrics.sortinoRatio());  // no downside samples
    }
}
