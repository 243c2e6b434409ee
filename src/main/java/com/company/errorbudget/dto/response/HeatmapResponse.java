package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Highest risk level per service per time bucket, oldest bucket first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapResponse {
    private int hours;
    private int intervalHours;
    private List<Instant> buckets;
    private List<Row> services;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Row {
        private String serviceName;
        private List<RiskLevel> riskLevels;
    }
}
