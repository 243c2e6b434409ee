package com.company.errorbudget.dto.response;

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
public class ServiceSummaryResponse {
    private String serviceName;
    private Integer tier;
    private String ownerTeam;
    private Instant generatedAt;
    private RiskLevel riskLevel;
    private List<BurnRateResponse> latestSnapshots;
    private ForecastResponse forecast;
    private ReleaseDecisionResponse releaseGate;
    private List<AlertResponse> openAlerts;
    private String narrative;
}
