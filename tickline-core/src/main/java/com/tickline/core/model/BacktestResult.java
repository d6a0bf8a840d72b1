package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tickline.core.journal.ExecutionEvent;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.UUID;

/**
 * Result of a backtest run. This is the only artifact handed to metrics,
 * reporting and persistence consumers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestResult(
    String runId,                           // Unique ID for this run
    BacktestConfig config,
    SortedMap<Long, Double> equityCurve,    // timestamp -> equity, one entry per processed timestamp
    List<EquitySample> positionsHistory,    // same timestamps, with cash and position snapshots
    List<Trade> trades,
    List<Signal> signals,                   // every signal the strategy returned, FLAT included
    List<ExecutionEvent> events,
    List<String> errors,                    // isolated per-step failures (run still completed)
    double finalCash,
    Map<String, PositionSnapshot> openPositions,  // positions still open when the data ran out
    List<String> symbols,
    int barsProcessed,                      // number of timeline steps
    long startTime,
    long endTime,
    long duration
) {
    /**
     * Generate a new unique run ID
     */
    public static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Check if the backtest completed without any isolated step failure
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return errors == null || errors.isEmpty();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return equityCurve.isEmpty();
    }

    /**
     * Equity at the last recorded sample, or the initial capital for an empty run.
     */
    @JsonIgnore
    public double finalEquity() {
        return equityCurve.isEmpty() ? config.initialCapital() : equityCurve.get(equityCurve.lastKey());
    }

    @JsonIgnore
    public boolean endedFlat() {
        return openPositions == null || openPositions.isEmpty();
    }

    /**
     * Sum of net P&L over all recorded trades.
     */
    @JsonIgnore
    public double realizedPnl() {
        return trades.stream().mapToDouble(Trade::netPnl).sum();
    }

    /**
     * Get summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format(
            "%s: %d symbols, %d steps, %d trades, final equity %.2f, %d errors",
            runId,
            symbols.size(),
            barsProcessed,
            trades.size(),
            finalEquity(),
            errors.size()
        );
    }
}
