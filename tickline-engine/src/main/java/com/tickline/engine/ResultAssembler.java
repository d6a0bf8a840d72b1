package com.tickline.engine;

import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.BacktestResult;
import com.tickline.core.model.EquitySample;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Packages a finished run into an immutable {@link BacktestResult}.
 */
class ResultAssembler {

    private ResultAssembler() {
    }

    static BacktestResult assemble(String runId, BacktestConfig config, RunState state,
                                   List<String> symbols, int barsProcessed, long startTime) {
        SortedMap<Long, Double> equityCurve = new TreeMap<>();
        for (EquitySample sample : state.samples) {
            equityCurve.put(sample.timestamp(), sample.equity());
        }

        long endTime = System.currentTimeMillis();
        return new BacktestResult(
            runId,
            config,
            Collections.unmodifiableSortedMap(equityCurve),
            List.copyOf(state.samples),
            List.copyOf(state.trades),
            List.copyOf(state.signals),
            List.copyOf(state.journal.getEvents()),
            List.copyOf(state.errors),
            state.portfolio.getCash(),
            state.portfolio.getLedger().snapshot(),
            List.copyOf(symbols),
            barsProcessed,
            startTime,
            endTime,
            endTime - startTime
        );
    }
}
