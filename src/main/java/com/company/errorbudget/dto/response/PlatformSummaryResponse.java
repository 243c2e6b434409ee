package com.company.errorbudget.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformSummaryResponse {
    private Instant generatedAt;
    private int totalServices;
    private Map<String, Integer> riskDistribution;
    private double averageBudgetRemaining;
    private Double lowestBudgetRemaining;
    private String lowestBudgetService;
    private ForecastResponse nearestExhaustion;
    private int activeAlerts;
    private int criticalAlerts;
    // healthy, degraded or critical
    private String overallHealth;
}
