package com.company.errorbudget.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Registers a service. Without explicit targets a default availability SLO is created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateServiceRequest {
    @NotBlank(message = "Service name is required")
    @Size(max = 100)
    @Pattern(regexp = "^[a-z0-9][a-z0-9-]*$", message = "Service name must be lowercase alphanumeric with dashes")
    private String name;

    @Size(max = 1000)
    private String description;

    @Size(max = 100)
    private String ownerTeam;

    @Min(value = 1, message = "Tier must be between 1 and 3")
    @Max(value = 3, message = "Tier must be between 1 and 3")
    private Integer tier;

    @Valid
    private List<SloTargetRequest> sloTargets;
}
