package com.company.errorbudget.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BurnHistoryResponse {
    private String serviceName;
    private int periodHours;
    private List<BurnRateResponse> latest;
    private List<BurnRateResponse> history;
    private double averageCompositeBurnRate;
    private double peakCompositeBurnRate;
}
