package com.company.errorbudget.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Release check with override for the service named in the path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverrideRequest {
    @NotBlank(message = "deployment_id is required")
    @Size(max = 200)
    private String deploymentId;

    @Size(max = 100)
    private String version;

    @Size(max = 200)
    private String requestedBy;

    @Size(max = 2000)
    private String overrideReason;
}
