package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Performance metrics calculated from a backtest result.
 * Return-based statistics use per-sample returns of the equity curve.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerformanceMetrics(
    int totalTrades,
    int winningTrades,
    int losingTrades,
    double winRate,             // percent
    double profitFactor,
    double grossProfit,
    double grossLoss,           // positive number
    double netProfit,
    double averageWin,
    double averageLoss,         // positive number
    double largestWin,
    double largestLoss,         // positive number
    double totalCommission,
    double totalSlippage,
    double totalReturn,         // fraction, 0.05 = +5%
    double maxDrawdown,         // fraction of the running peak
    int maxDrawdownDuration,    // samples spent below a prior peak, longest stretch
    double volatility,          // annualized
    double sharpeRatio,
    double sortinoRatio,
    double averageHoldingHours,
    double finalEquity
) {
    public static final int DEFAULT_PERIODS_PER_YEAR = 252;

    /**
     * Create empty metrics (no trades, no samples)
     */
    public static PerformanceMetrics empty(double initialCapital) {
        return new PerformanceMetrics(
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, initialCapital
        );
    }

    public static PerformanceMetrics calculate(BacktestResult result) {
        return calculate(result, DEFAULT_PERIODS_PER_YEAR);
    }

    /**
     * Calculate metrics from a result.
     *
     * @param periodsPerYear number of equity samples per year, used to annualize
     */
    public static PerformanceMetrics calculate(BacktestResult result, int periodsPerYear) {
        double initialCapital = result.config().initialCapital();
        if (result.trades().isEmpty() && result.equityCurve().isEmpty()) {
            return empty(initialCapital);
        }

        int winners = 0;
        int losers = 0;
        double grossProfit = 0;
        double grossLoss = 0;
        double largestWin = 0;
        double largestLoss = 0;
        double commission = 0;
        double slippage = 0;
        double holdingMillis = 0;

        for (Trade t : result.trades()) {
            commission += t.commission();
            slippage += t.slippageCost();
            holdingMillis += t.holdingMillis();

            double pnl = t.netPnl();
            if (t.isWinner()) {
                winners++;
                grossProfit += pnl;
                largestWin = Math.max(largestWin, pnl);
            } else if (pnl < 0) {
                losers++;
                grossLoss += Math.abs(pnl);
                largestLoss = Math.max(largestLoss, Math.abs(pnl));
            }
        }

        int total = result.trades().size();
        double winRate = total > 0 ? (double) winners / total * 100 : 0;
        double profitFactor = grossLoss > 0 ? grossProfit / grossLoss : grossProfit > 0 ? Double.POSITIVE_INFINITY : 0;
        double avgWin = winners > 0 ? grossProfit / winners : 0;
        double avgLoss = losers > 0 ? grossLoss / losers : 0;
        double avgHolding = total > 0 ? holdingMillis / total / (60 * 60 * 1000) : 0;

        List<Double> equity = new ArrayList<>(result.equityCurve().values());
        double finalEquity = result.finalEquity();
        double totalReturn = (finalEquity - initialCapital) / initialCapital;

        // Drawdown
        double peak = equity.isEmpty() ? initialCapital : equity.get(0);
        double maxDD = 0;
        int ddLength = 0;
        int maxDDLength = 0;
        for (double e : equity) {
            if (e >= peak) {
                peak = e;
                ddLength = 0;
            } else {
                ddLength++;
                maxDDLength = Math.max(maxDDLength, ddLength);
                if (peak > 0) {
                    maxDD = Math.max(maxDD, (peak - e) / peak);
                }
            }
        }

        // Per-sample returns; samples following a non-positive equity are skipped
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equity.size(); i++) {
            double prev = equity.get(i - 1);
            if (prev > 0) {
                returns.add(equity.get(i) / prev - 1);
            }
        }

        double volatility = 0;
        double sharpe = 0;
        double sortino = 0;
        if (returns.size() > 1) {
            double periodRiskFree = result.config().riskFreeRate() / periodsPerYear;
            double mean = returns.stream().mapToDouble(d -> d).average().orElse(0);
            double variance = returns.stream().mapToDouble(d -> Math.pow(d - mean, 2)).average().orElse(0);
            double stdDev = Math.sqrt(variance);
            double excessMean = mean - periodRiskFree;
            double downsideVariance = returns.stream()
                .mapToDouble(d -> Math.min(d - periodRiskFree, 0))
                .map(d -> d * d)
                .average().orElse(0);
            double downsideDev = Math.sqrt(downsideVariance);

            volatility = stdDev * Math.sqrt(periodsPerYear);
            if (stdDev > 0) {
                sharpe = excessMean / stdDev * Math.sqrt(periodsPerYear);
            }
            if (downsideDev > 0) {
                sortino = excessMean / downsideDev * Math.sqrt(periodsPerYear);
            }
        }

        return new PerformanceMetrics(
            total, winners, losers, winRate, profitFactor,
            grossProfit, grossLoss, grossProfit - grossLoss, avgWin, avgLoss, largestWin, largestLoss,
            commission, slippage, totalReturn, maxDD, maxDDLength, volatility, sharpe, sortino,
            avgHolding, finalEquity
        );
    }
}
