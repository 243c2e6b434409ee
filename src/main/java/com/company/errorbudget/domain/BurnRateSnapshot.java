package com.company.errorbudget.domain;

import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Result of one evaluation tick for a (service, SLO) pair. Append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BurnRateSnapshot implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long snapshotId;
    private Long serviceId;
    private String serviceName;
    private Long sloTargetId;
    private Instant evaluatedAt;

    private double errorRate5m;
    private double errorRate1h;
    private double errorRate24h;

    private double burnRate5m;
    private double burnRate1h;
    private double burnRate24h;
    private double compositeBurnRate;

    // Percent of the compliance-window budget
    private double errorBudgetConsumed;
    private double errorBudgetRemaining;

    private RiskLevel riskLevel;
}
