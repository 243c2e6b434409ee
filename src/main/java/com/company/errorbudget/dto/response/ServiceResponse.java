package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceResponse {
    private Long serviceId;
    private String name;
    private String description;
    private String ownerTeam;
    private Integer tier;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;
    private List<SloTargetResponse> sloTargets;

    public static ServiceResponse from(MonitoredService service, List<SloTarget> targets) {
        return ServiceResponse.builder()
                .serviceId(service.getServiceId())
                .name(service.getName())
                .description(service.getDescription())
                .ownerTeam(service.getOwnerTeam())
                .tier(service.getTier())
                .active(service.getActive())
                .createdAt(service.getCreatedAt())
                .updatedAt(service.getUpdatedAt())
                .sloTargets(targets.stream().map(SloTargetResponse::from).collect(Collectors.toList()))
                .build();
    }
}
