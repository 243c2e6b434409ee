package com.company.errorbudget.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Gate state a release would get now (not recorded) plus recent decisions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseStatusResponse {
    private String serviceName;
    private ReleaseDecisionResponse current;
    private List<ReleaseDecisionResponse> recentDecisions;
}
