package com.company.errorbudget.engine;

import com.company.errorbudget.domain.TrafficSample;
import com.company.errorbudget.domain.enums.EvaluationWindow;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reduces raw traffic samples into per-window error rates.
 * Windows always look backward from the evaluation instant.
 */
@Component
public class WindowAggregator {

    public Map<EvaluationWindow, WindowRate> aggregate(Collection<TrafficSample> samples, Instant at) {
        Map<EvaluationWindow, WindowRate> rates = new EnumMap<>(EvaluationWindow.class);
        for (EvaluationWindow window : EvaluationWindow.values()) {
            rates.put(window, aggregate(samples, at, window));
        }
        return rates;
    }

    /**
     * Sums samples with timestamps in {@code [at - window, at]}.
     */
    public WindowRate aggregate(Collection<TrafficSample> samples, Instant at, EvaluationWindow window) {
        Instant from = at.minus(window.getDuration());
        long total = 0;
        long errors = 0;
        for (TrafficSample sample : samples) {
            Instant ts = sample.getTimestamp();
            if (ts.isBefore(from) || ts.isAfter(at)) {
                continue;
            }
            total += sample.getTotalRequests();
            errors += sample.getErrorCount();
        }
        return WindowRate.of(total, errors);
    }

    /**
     * Sorted view of the samples for repeated interval sums.
     */
    public SampleTimeline timeline(Collection<TrafficSample> samples) {
        return new SampleTimeline(samples);
    }
}
