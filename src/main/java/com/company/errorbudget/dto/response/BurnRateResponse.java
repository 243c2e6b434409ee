package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BurnRateResponse {
    private Long snapshotId;
    private String serviceName;
    private Long sloTargetId;
    private Instant evaluatedAt;

    @JsonProperty("error_rate_5m")
    private double errorRate5m;
    @JsonProperty("error_rate_1h")
    private double errorRate1h;
    @JsonProperty("error_rate_24h")
    private double errorRate24h;

    @JsonProperty("burn_rate_5m")
    private double burnRate5m;
    @JsonProperty("burn_rate_1h")
    private double burnRate1h;
    @JsonProperty("burn_rate_24h")
    private double burnRate24h;
    private double compositeBurnRate;

    private double errorBudgetConsumed;
    private double errorBudgetRemaining;
    private RiskLevel riskLevel;

    public static BurnRateResponse from(BurnRateSnapshot snapshot) {
        return BurnRateResponse.builder()
                .snapshotId(snapshot.getSnapshotId())
                .serviceName(snapshot.getServiceName())
                .sloTargetId(snapshot.getSloTargetId())
                .evaluatedAt(snapshot.getEvaluatedAt())
                .errorRate5m(snapshot.getErrorRate5m())
                .errorRate1h(snapshot.getErrorRate1h())
                .errorRate24h(snapshot.getErrorRate24h())
                .burnRate5m(snapshot.getBurnRate5m())
                .burnRate1h(snapshot.getBurnRate1h())
                .burnRate24h(snapshot.getBurnRate24h())
                .compositeBurnRate(snapshot.getCompositeBurnRate())
                .errorBudgetConsumed(snapshot.getErrorBudgetConsumed())
                .errorBudgetRemaining(snapshot.getErrorBudgetRemaining())
                .riskLevel(snapshot.getRiskLevel())
                .build();
    }
}
