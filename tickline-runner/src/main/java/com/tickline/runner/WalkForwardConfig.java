package com.tickline.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tickline.core.model.BacktestException;

/**
 * Rolling walk-forward window layout.
 *
 * @param trainPeriodDays length of each training slice
 * @param testPeriodDays  length of each out-of-sample slice, starting where training ends
 * @param stepDays        shift between consecutive window starts
 * @param parallelism     number of windows run concurrently
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalkForwardConfig(
    int trainPeriodDays,
    int testPeriodDays,
    int stepDays,
    int parallelism
) {
    public static final long DAY_MILLIS = 24L * 60 * 60 * 1000;

    public WalkForwardConfig {
        if (trainPeriodDays <= 0 || testPeriodDays <= 0 || stepDays <= 0) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG,
                "Walk-forward periods must be positive: train=" + trainPeriodDays
                    + ", test=" + testPeriodDays + ", step=" + stepDays);
        }
        if (parallelism <= 0) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG,
                "Walk-forward parallelism must be positive: " + parallelism);
        }
    }

    /**
     * Six months train, one month test, one month step, one thread per available core.
     */
    public static WalkForwardConfig defaults() {
        return new WalkForwardConfig(180, 30, 30, Runtime.getRuntime().availableProcessors());
    }

    public WalkForwardConfig withParallelism(int threads) {
        return new WalkForwardConfig(trainPeriodDays, testPeriodDays, stepDays, threads);
    }

    @JsonIgnore
    public long trainMillis() {
        return trainPeriodDays * DAY_MILLIS;
    }

    @JsonIgnore
    public long testMillis() {
        return testPeriodDays * DAY_MILLIS;
    }

    @JsonIgnore
    public long stepMillis() {
        return stepDays * DAY_MILLIS;
    }
}
