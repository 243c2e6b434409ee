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
public class AlertStatisticsResponse {
    private int periodHours;
    private long total;
    private int unacknowledged;
    private Map<String, Long> bySeverity;
}
