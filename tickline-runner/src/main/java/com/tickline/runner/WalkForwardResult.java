package com.tickline.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tickline.core.model.PerformanceMetrics;
import com.tickline.core.model.Trade;

import java.util.List;
import java.util.SortedMap;

/**
 * Outcome of a walk-forward validation.
 *
 * @param windows        completed windows in chronological order
 * @param combinedEquity out-of-sample equity of all test slices chained end to end,
 *                       starting at the initial capital
 * @param combinedTrades every trade from every test slice
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalkForwardResult(
    WalkForwardConfig config,
    List<WalkForwardWindow> windows,
    SortedMap<Long, Double> combinedEquity,
    List<Trade> combinedTrades,
    PerformanceMetrics combinedMetrics,
    MetricsSummary trainSummary,
    MetricsSummary testSummary,
    List<String> errors
) {
    @JsonIgnore
    public int windowCount() {
        return windows.size();
    }

    @JsonIgnore
    public String getSummary() {
        return String.format(
            "%d windows, OOS return %.2f%%, OOS Sharpe %.2f, test consistency %.0f%%, %d errors",
            windows.size(),
            combinedMetrics.totalReturn() * 100,
            combinedMetrics.sharpeRatio(),
            testSummary.consistency() * 100,
            errors.size()
        );
    }
}
