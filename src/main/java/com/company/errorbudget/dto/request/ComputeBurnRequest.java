package com.company.errorbudget.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Service to evaluate now; all active services when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComputeBurnRequest {
    private String serviceName;
}
