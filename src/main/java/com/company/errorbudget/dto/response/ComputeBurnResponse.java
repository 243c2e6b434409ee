package com.company.errorbudget.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComputeBurnResponse {
    private int servicesEvaluated;
    private List<BurnRateResponse> snapshots;
    // service name -> error message
    private Map<String, String> failures;
}
