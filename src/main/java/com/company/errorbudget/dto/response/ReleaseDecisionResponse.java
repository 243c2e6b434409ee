package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.ReleaseDecision;
import com.company.errorbudget.domain.enums.GateState;
import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseDecisionResponse {
    private Long decisionId;
    private String serviceName;
    private String deploymentId;
    private String version;
    private String requestedBy;
    private GateState state;
    private boolean allowed;
    private String reason;
    private RiskLevel riskLevel;
    private double compositeBurnRate;
    private double errorBudgetRemaining;
    private Double timeToExhaustionHours;
    // Evaluation the decision was based on; null before the first evaluation
    private Instant snapshotEvaluatedAt;
    private boolean overrideRequested;
    private boolean overridden;
    private String overrideReason;
    private List<String> recommendations;
    private Instant decidedAt;

    public static ReleaseDecisionResponse from(ReleaseDecision decision) {
        return ReleaseDecisionResponse.builder()
                .decisionId(decision.getDecisionId())
                .serviceName(decision.getServiceName())
                .deploymentId(decision.getDeploymentId())
                .version(decision.getVersion())
                .requestedBy(decision.getRequestedBy())
                .state(decision.getState())
                .allowed(decision.isAllowed())
                .reason(decision.getReason())
                .riskLevel(decision.getRiskLevel())
                .compositeBurnRate(decision.getCompositeBurnRate())
                .errorBudgetRemaining(decision.getErrorBudgetRemaining())
                .timeToExhaustionHours(decision.getTimeToExhaustionHours())
                .snapshotEvaluatedAt(decision.getSnapshotEvaluatedAt())
                .overrideRequested(decision.isOverrideRequested())
                .overridden(decision.isOverridden())
                .overrideReason(decision.getOverrideReason())
                .recommendations(decision.getRecommendations())
                .decidedAt(decision.getDecidedAt())
                .build();
    }
}
