package com.company.errorbudget.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseStatisticsResponse {
    private int periodDays;
    private int totalChecks;
    private int allowed;
    private int blocked;
    private int overrides;
    private double blockRate;
    // Risk level at request time
    private Map<String, Integer> riskDistribution;
}
