package com.company.errorbudget.engine;

import lombok.Value;

/**
 * Lower edges of the OBSERVE, DANGER and FREEZE bands, in burn-rate multiples.
 */
@Value
public class RiskThresholds {
    public static final double DEFAULT_OBSERVE = 1.0;
    public static final double DEFAULT_DANGER = 1.5;
    public static final double DEFAULT_FREEZE = 2.0;

    public static final RiskThresholds DEFAULT =
            new RiskThresholds(DEFAULT_OBSERVE, DEFAULT_DANGER, DEFAULT_FREEZE);

    double observe;
    double danger;
    double freeze;
}
