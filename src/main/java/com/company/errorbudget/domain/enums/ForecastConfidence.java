package com.company.errorbudget.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastConfidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ForecastConfidence fromString(String confidence) {
        if (confidence == null) {
            return LOW;
        }
        try {
            return ForecastConfidence.valueOf(confidence.toUpperCase());
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}
