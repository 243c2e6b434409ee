package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Compliance of every active target of a service over its current window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SloStatusResponse {
    private String serviceName;
    private Instant evaluatedAt;
    private List<TargetStatus> targets;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TargetStatus {
        private Long targetId;
        private String name;
        private Double targetValue;
        private Integer windowDays;
        private Instant windowStart;
        private Instant windowEnd;

        // Percent of successful requests; null without traffic
        private Double currentAvailability;
        private boolean meetingSlo;

        private double errorBudgetConsumed;
        private double errorBudgetRemaining;

        @JsonProperty("availability_5m")
        private Double availability5m;
        @JsonProperty("availability_1h")
        private Double availability1h;
        @JsonProperty("availability_24h")
        private Double availability24h;

        private RiskLevel riskLevel;
        private Instant lastEvaluatedAt;
    }
}
