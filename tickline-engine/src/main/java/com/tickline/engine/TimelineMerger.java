package com.tickline.engine;

import com.tickline.core.model.Bar;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the global timeline: the ascending, de-duplicated union of every
 * timestamp observed in any symbol's bars.
 */
public final class TimelineMerger {

    private TimelineMerger() {
    }

    public static long[] merge(Map<String, List<Bar>> barsBySymbol) {
        return merge(barsBySymbol.values());
    }

    public static long[] merge(Collection<List<Bar>> series) {
        TreeSet<Long> timestamps = new TreeSet<>();
        for (List<Bar> bars : series) {
            for (Bar bar : bars) {
                timestamps.add(bar.timestamp());
            }
        }
        long[] timeline = new long[timestamps.size()];
        int i = 0;
        for (long ts : timestamps) {
            timeline[i++] = ts;
        }
        return timeline;
    }
}
