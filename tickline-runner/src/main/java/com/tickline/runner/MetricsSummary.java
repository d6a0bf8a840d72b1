package com.tickline.runner;

import com.tickline.core.model.PerformanceMetrics;

import java.util.Arrays;
import java.util.List;

/**
 * Distribution of key metrics across walk-forward windows.
 * Standard deviations are population deviations.
 */
public record MetricsSummary(
    int windowCount,
    double sharpeMean,
    double sharpeStd,
    double sharpeMin,
    double sharpeMax,
    double returnMean,
    double returnStd,
    double drawdownMean,
    double drawdownMax,
    double winRateMean,
    double consistency          // fraction of windows with a positive Sharpe ratio
) {
    public static MetricsSummary empty() {
        return new MetricsSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public static MetricsSummary of(List<PerformanceMetrics> metrics) {
        if (metrics.isEmpty()) {
            return empty();
        }
        double[] sharpes = metrics.stream().mapToDouble(PerformanceMetrics::sharpeRatio).toArray();
        double[] returns = metrics.stream().mapToDouble(PerformanceMetrics::totalReturn).toArray();
        double[] drawdowns = metrics.stream().mapToDouble(PerformanceMetrics::maxDrawdown).toArray();
        double[] winRates = metrics.stream().mapToDouble(PerformanceMetrics::winRate).toArray();

        long positive = Arrays.stream(sharpes).filter(s -> s > 0).count();

        return new MetricsSummary(
            metrics.size(),
            mean(sharpes),
            std(sharpes),
            Arrays.stream(sharpes).min().orElse(0),
            Arrays.stream(sharpes).max().orElse(0),
            mean(returns),
            std(returns),
            mean(drawdowns),
            Arrays.stream(drawdowns).max().orElse(0),
            mean(winRates),
            (double) positive / sharpes.length
        );
    }

    private static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(0);
    }

    private static double std(double[] values) {
        double mean = mean(values);
        return Math.sqrt(Arrays.stream(values).map(v -> (v - mean) * (v - mean)).average().orElse(0));
    }
}
