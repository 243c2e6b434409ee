package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.Forecast;
import com.company.errorbudget.domain.enums.BurnRateTrend;
import com.company.errorbudget.domain.enums.ForecastConfidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastResponse {
    private String serviceName;
    private Instant computedAt;
    private double currentBurnRate;
    private double errorBudgetRemaining;
    // Budget percent per hour; negative while draining
    private double trendSlope;
    private BurnRateTrend burnRateTrend;
    private Double timeToExhaustionHours;
    private Instant projectedExhaustionTime;
    private ForecastConfidence confidenceLevel;
    private int dataPoints;
    private double fitQuality;
    private String forecastMessage;

    public static ForecastResponse from(Forecast forecast) {
        return ForecastResponse.builder()
                .serviceName(forecast.getServiceName())
                .computedAt(forecast.getComputedAt())
                .currentBurnRate(forecast.getCurrentBurnRate())
                .errorBudgetRemaining(forecast.getErrorBudgetRemaining())
                .trendSlope(forecast.getTrendSlope())
                .burnRateTrend(forecast.getBurnRateTrend())
                .timeToExhaustionHours(forecast.getTimeToExhaustionHours())
                .projectedExhaustionTime(forecast.getProjectedExhaustionTime())
                .confidenceLevel(forecast.getConfidenceLevel())
                .dataPoints(forecast.getDataPoints())
                .fitQuality(forecast.getRSquared())
                .forecastMessage(forecast.getForecastMessage())
                .build();
    }
}
