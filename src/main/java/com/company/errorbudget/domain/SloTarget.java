package com.company.errorbudget.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SloTarget {
    public static final String AVAILABILITY = "availability";

    private Long targetId;
    private Long serviceId;
    private String name;          // e.g. availability
    private Double targetValue;   // percent, 0 < value < 100
    private Integer windowDays;   // compliance window length
    private Double burnRateThreshold;  // OBSERVE boundary
    private Double criticalBurnRate;   // FREEZE boundary
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Fraction of requests allowed to fail, e.g. 0.001 for a 99.9% target.
     */
    public double allowedErrorRate() {
        return (100.0 - targetValue) / 100.0;
    }

    public Duration complianceWindow() {
        return Duration.ofDays(windowDays);
    }

    public boolean isAvailability() {
        return AVAILABILITY.equalsIgnoreCase(name);
    }
}
