package com.company.errorbudget.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateServiceRequest {
    @Size(max = 1000)
    private String description;

    @Size(max = 100)
    private String ownerTeam;

    @Min(1)
    @Max(3)
    private Integer tier;

    private Boolean active;
}
