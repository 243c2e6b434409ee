package com.company.errorbudget.domain.enums;

import java.time.Duration;

/**
 * Rolling windows used for burn rate evaluation and their weight in the composite.
 * Weights sum to 1.0 and are never renormalized.
 */
public enum EvaluationWindow {
    FIVE_MINUTES("5m", Duration.ofMinutes(5), 0.40),
    ONE_HOUR("1h", Duration.ofHours(1), 0.35),
    TWENTY_FOUR_HOURS("24h", Duration.ofHours(24), 0.25);

    private final String label;
    private final Duration duration;
    private final double weight;

    EvaluationWindow(String label, Duration duration, double weight) {
        this.label = label;
        this.duration = duration;
        this.weight = weight;
    }

    public String getLabel() {
        return label;
    }

    public Duration getDuration() {
        return duration;
    }

    public double getWeight() {
        return weight;
    }

    public static Duration longest() {
        return TWENTY_FOUR_HOURS.duration;
    }
}
