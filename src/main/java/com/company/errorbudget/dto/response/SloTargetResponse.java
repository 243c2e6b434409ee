package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.SloTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SloTargetResponse {
    private Long targetId;
    private Long serviceId;
    private String name;
    private Double targetValue;
    private Integer windowDays;
    private Double burnRateThreshold;
    private Double criticalBurnRate;
    private double allowedErrorRate;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public static SloTargetResponse from(SloTarget target) {
        return SloTargetResponse.builder()
                .targetId(target.getTargetId())
                .serviceId(target.getServiceId())
                .name(target.getName())
                .targetValue(target.getTargetValue())
                .windowDays(target.getWindowDays())
                .burnRateThreshold(target.getBurnRateThreshold())
                .criticalBurnRate(target.getCriticalBurnRate())
                .allowedErrorRate(target.allowedErrorRate())
                .active(target.getActive())
                .createdAt(target.getCreatedAt())
                .updatedAt(target.getUpdatedAt())
                .build();
    }
}
