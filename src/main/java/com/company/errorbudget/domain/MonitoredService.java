package com.company.errorbudget.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A service whose SLOs are evaluated. Tier 1 is critical, 3 is standard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredService {
    private Long serviceId;
    private String name;
    private String description;
    private String ownerTeam;
    private Integer tier;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
