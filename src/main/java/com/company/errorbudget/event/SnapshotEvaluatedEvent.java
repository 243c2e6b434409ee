package com.company.errorbudget.event;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SnapshotEvaluatedEvent {
    private final BurnRateSnapshot snapshot;
    private final RiskLevel previousRiskLevel;
}
