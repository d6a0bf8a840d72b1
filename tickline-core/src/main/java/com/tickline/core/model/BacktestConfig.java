package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Configuration for a backtest run.
 * Invalid values are rejected at construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestConfig(
    double initialCapital,
    double commissionPerShare,
    double slippageBps,
    boolean fillOnNextBar,          // fill at the next bar's open instead of the signal bar's open
    boolean allowFractionalShares,
    double maxPositionPct,          // fraction of equity per engine-sized position, in (0, 1]
    double riskFreeRate,            // annual, only used by metrics
    int featureWindowBars           // trailing rows handed to the strategy, 0 = full history
) {
    public BacktestConfig {
        if (!(initialCapital > 0) || Double.isInfinite(initialCapital)) {
            throw invalid("initialCapital must be > 0, was " + initialCapital);
        }
        if (!(commissionPerShare >= 0)) {
            throw invalid("commissionPerShare must be >= 0, was " + commissionPerShare);
        }
        if (!(slippageBps >= 0)) {
            throw invalid("slippageBps must be >= 0, was " + slippageBps);
        }
        if (!(maxPositionPct > 0 && maxPositionPct <= 1)) {
            throw invalid("maxPositionPct must be in (0, 1], was " + maxPositionPct);
        }
        if (Double.isNaN(riskFreeRate)) {
            throw invalid("riskFreeRate must be a number");
        }
        if (featureWindowBars < 0) {
            throw invalid("featureWindowBars must be >= 0, was " + featureWindowBars);
        }
    }

    /**
     * Create default config
     */
    public static BacktestConfig defaults() {
        return new BacktestConfig(
            100000.0,
            0.005,
            5.0,
            true,
            true,
            1.0,
            0.0,
            0
        );
    }

    /**
     * Frictionless config: no commission, no slippage, next-bar fills.
     */
    public static BacktestConfig frictionless(double initialCapital) {
        return new BacktestConfig(initialCapital, 0, 0, true, true, 1.0, 0.0, 0);
    }

    public BacktestConfig withCosts(double commissionPerShare, double slippageBps) {
        return new BacktestConfig(initialCapital, commissionPerShare, slippageBps, fillOnNextBar,
            allowFractionalShares, maxPositionPct, riskFreeRate, featureWindowBars);
    }

    public BacktestConfig withFillOnNextBar(boolean fillOnNextBar) {
        return new BacktestConfig(initialCapital, commissionPerShare, slippageBps, fillOnNextBar,
            allowFractionalShares, maxPositionPct, riskFreeRate, featureWindowBars);
    }

    public BacktestConfig withFractionalShares(boolean allowFractionalShares) {
        return new BacktestConfig(initialCapital, commissionPerShare, slippageBps, fillOnNextBar,
            allowFractionalShares, maxPositionPct, riskFreeRate, featureWindowBars);
    }

    public BacktestConfig withMaxPositionPct(double maxPositionPct) {
        return new BacktestConfig(initialCapital, commissionPerShare, slippageBps, fillOnNextBar,
            allowFractionalShares, maxPositionPct, riskFreeRate, featureWindowBars);
    }

    public BacktestConfig withFeatureWindowBars(int featureWindowBars) {
        return new BacktestConfig(initialCapital, commissionPerShare, slippageBps, fillOnNextBar,
            allowFractionalShares, maxPositionPct, riskFreeRate, featureWindowBars);
    }

    /**
     * Slippage multiplier applied to opening fills: 1 + bps / 10000.
     */
    public double slippageMultiplier() {
        return 1 + slippageBps / 10000.0;
    }

    private static BacktestException invalid(String message) {
        return new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG, message);
    }
}
