package com.company.errorbudget.domain;

import com.company.errorbudget.domain.enums.BurnRateTrend;
import com.company.errorbudget.domain.enums.ForecastConfidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Budget exhaustion projection. Derived on demand, never authoritative state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Forecast implements Serializable {
    private static final long serialVersionUID = 1L;

    private String serviceName;
    private Instant computedAt;
    private int dataPoints;
    private double trendSlope;          // budget percent per hour
    private double rSquared;
    private BurnRateTrend burnRateTrend;
    private Double timeToExhaustionHours;
    private Instant projectedExhaustionTime;
    private ForecastConfidence confidenceLevel;
    private double currentBurnRate;
    private double errorBudgetRemaining;
    private String forecastMessage;
}
