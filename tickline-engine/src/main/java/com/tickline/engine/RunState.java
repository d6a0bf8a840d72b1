package com.tickline.engine;

import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.EquitySample;
import com.tickline.core.model.Signal;
import com.tickline.core.model.Trade;
import com.tickline.engine.journal.ExecutionJournal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one run. Created inside {@link BacktestEngine#run} and
 * never shared, so an engine holds nothing but its configuration.
 */
class RunState {

    final Portfolio portfolio;
    final ExecutionJournal journal = new ExecutionJournal();
    final ExecutionSimulator simulator;
    final SignalAdapter adapter;

    final Deque<PendingOrder> pending = new ArrayDeque<>();
    // Orders already journaled as DEFERRED, by identity
    final Set<PendingOrder> deferred = Collections.newSetFromMap(new IdentityHashMap<>());
    final List<Signal> signals = new ArrayList<>();
    final List<Trade> trades = new ArrayList<>();
    final List<EquitySample> samples = new ArrayList<>();
    final List<String> errors = new ArrayList<>();

    RunState(BacktestConfig config) {
        this.portfolio = new Portfolio(config.initialCapital());
        this.simulator = new ExecutionSimulator(config, portfolio, journal);
        this.adapter = new SignalAdapter(config, portfolio, journal);
    }

    EquitySample recordSample(long timestamp) {
        EquitySample sample = new EquitySample(
            timestamp,
            portfolio.getCash(),
            portfolio.equity(),
            portfolio.getLedger().snapshot()
        );
        samples.add(sample);
        return sample;
    }
}
