package com.company.errorbudget.domain.enums;

public enum AlertCategory {
    /** Risk level transition of an SLO. */
    SLO_RISK,
    /** Evaluation pipeline health, e.g. repeated storage failures. */
    OPERATIONAL;

    public static AlertCategory fromString(String category) {
        if (category == null) {
            return SLO_RISK;
        }
        try {
            return AlertCategory.valueOf(category.toUpperCase());
        } catch (IllegalArgumentException e) {
            return SLO_RISK;
        }
    }
}
