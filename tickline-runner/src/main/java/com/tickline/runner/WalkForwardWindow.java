package com.tickline.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tickline.core.model.BacktestResult;
import com.tickline.core.model.PerformanceMetrics;

/**
 * One train/test split and, once run, its two results.
 * Both ranges are half-open: [start, end).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalkForwardWindow(
    int windowId,
    long trainStart,
    long trainEnd,
    long testStart,
    long testEnd,
    BacktestResult trainResult,
    BacktestResult testResult,
    PerformanceMetrics trainMetrics,
    PerformanceMetrics testMetrics
) {
    /**
     * A window that has not been run yet.
     */
    public static WalkForwardWindow planned(int windowId, long trainStart, long trainEnd, long testStart, long testEnd) {
        return new WalkForwardWindow(windowId, trainStart, trainEnd, testStart, testEnd, null, null, null, null);
    }

    public WalkForwardWindow withResults(BacktestResult train, BacktestResult test, int periodsPerYear) {
        return new WalkForwardWindow(windowId, trainStart, trainEnd, testStart, testEnd,
            train, test,
            PerformanceMetrics.calculate(train, periodsPerYear),
            PerformanceMetrics.calculate(test, periodsPerYear));
    }

    @JsonIgnore
    public boolean isComplete() {
        return trainResult != null && testResult != null;
    }
}
