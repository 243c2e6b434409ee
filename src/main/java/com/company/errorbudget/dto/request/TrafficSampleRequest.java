package com.company.errorbudget.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One time bucket of request outcomes. Either success_count or total_requests
 * must be given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrafficSampleRequest {
    @NotBlank(message = "service is required")
    private String service;

    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    @PositiveOrZero
    private Long successCount;

    @PositiveOrZero
    private Long totalRequests;

    @NotNull(message = "error_count is required")
    @PositiveOrZero
    private Long errorCount;
}
