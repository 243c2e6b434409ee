package com.company.errorbudget.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SLO target definition. Range checks live in SloTargetService so that create and
 * partial update share them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SloTargetRequest {
    @Size(max = 50)
    private String name;

    private Double targetValue;
    private Integer windowDays;
    private Double burnRateThreshold;
    private Double criticalBurnRate;
    private Boolean active;
}
