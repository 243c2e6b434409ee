package com.company.errorbudget.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of budget consumption. INCREASING means the budget drains faster.
 */
public enum BurnRateTrend {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BurnRateTrend fromString(String trend) {
        if (trend == null) {
            return STABLE;
        }
        try {
            return BurnRateTrend.valueOf(trend.toUpperCase());
        } catch (IllegalArgumentException e) {
            return STABLE;
        }
    }
}
