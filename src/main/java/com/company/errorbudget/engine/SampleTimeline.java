package com.company.errorbudget.engine;

import com.company.errorbudget.domain.TrafficSample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Samples sorted by timestamp with running totals, so the rate over any
 * {@code (from, to]} interval is two binary searches.
 */
public final class SampleTimeline {

    private final Instant[] times;
    private final long[] totalPrefix;
    private final long[] errorPrefix;

    SampleTimeline(Collection<TrafficSample> samples) {
        List<TrafficSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(TrafficSample::getTimestamp));

        int n = sorted.size();
        times = new Instant[n];
        totalPrefix = new long[n + 1];
        errorPrefix = new long[n + 1];
        for (int i = 0; i < n; i++) {
            TrafficSample sample = sorted.get(i);
            times[i] = sample.getTimestamp();
            totalPrefix[i + 1] = totalPrefix[i] + sample.getTotalRequests();
            errorPrefix[i + 1] = errorPrefix[i] + sample.getErrorCount();
        }
    }

    /**
     * Sums samples with timestamps in {@code (fromExclusive, toInclusive]}, so that
     * back-to-back intervals never count a sample twice.
     */
    public WindowRate between(Instant fromExclusive, Instant toInclusive) {
        int lo = countAtOrBefore(fromExclusive);
        int hi = countAtOrBefore(toInclusive);
        if (hi <= lo) {
            return WindowRate.EMPTY;
        }
        return WindowRate.of(totalPrefix[hi] - totalPrefix[lo], errorPrefix[hi] - errorPrefix[lo]);
    }

    private int countAtOrBefore(Instant at) {
        int lo = 0;
        int hi = times.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid].isAfter(at)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
