package com.company.errorbudget.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseCheckRequest {
    @NotBlank(message = "service_name is required")
    private String serviceName;

    @NotBlank(message = "deployment_id is required")
    @Size(max = 200)
    private String deploymentId;

    @Size(max = 100)
    private String version;

    @Size(max = 200)
    private String requestedBy;

    private boolean override;

    @Size(max = 2000)
    private String overrideReason;
}
