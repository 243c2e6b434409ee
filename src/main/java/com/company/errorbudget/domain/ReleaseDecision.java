package com.company.errorbudget.domain;

import com.company.errorbudget.domain.enums.GateState;
import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of one release gate check. Immutable once produced.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReleaseDecision {
    private final Long decisionId;
    private final Long serviceId;
    private final String serviceName;
    private final String deploymentId;
    private final String version;
    private final String requestedBy;

    private final boolean overrideRequested;
    private final String overrideReason;
    // True only when the override turned a block into an allow
    private final boolean overridden;

    private final GateState state;
    private final boolean allowed;
    private final String reason;

    private final RiskLevel riskLevel;
    private final double compositeBurnRate;
    private final double errorBudgetRemaining;
    private final Double timeToExhaustionHours;
    private final Instant snapshotEvaluatedAt;
    private final List<String> recommendations;

    private final Instant decidedAt;

    public static class ReleaseDecisionBuilder {
        public ReleaseDecisionBuilder recommendations(List<String> recommendations) {
            this.recommendations = recommendations == null ? null : List.copyOf(recommendations);
            return this;
        }
    }
}
