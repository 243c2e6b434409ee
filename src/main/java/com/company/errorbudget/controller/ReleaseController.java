package com.company.errorbudget.controller;

import com.company.errorbudget.dto.request.OverrideRequest;
import com.company.errorbudget.dto.request.ReleaseCheckRequest;
import com.company.errorbudget.dto.response.ReleaseDecisionResponse;
import com.company.errorbudget.dto.response.ReleaseStatisticsResponse;
import com.company.errorbudget.dto.response.ReleaseStatusResponse;
import com.company.errorbudget.service.ReleaseGateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Blocked releases are still 200 responses; callers read {@code allowed}.
 */
@RestController
@RequestMapping("/api/v1/release")
@Tag(name = "Release Gate", description = "Deployment gating on error budget risk")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class ReleaseController {

    private final ReleaseGateService releaseGateService;

    @PostMapping("/check")
    @Operation(summary = "Ask whether a deployment may proceed",
            description = "Decides from the last completed evaluation and records the decision")
    @PreAuthorize("hasAnyRole('RELEASE_PIPELINE', 'RELIABILITY_ADMIN')")
    public ResponseEntity<ReleaseDecisionResponse> check(@Valid @RequestBody ReleaseCheckRequest request) {
        log.debug("Release check for {} deployment {}", request.getServiceName(), request.getDeploymentId());
        return ResponseEntity.ok(releaseGateService.check(request));
    }

    @PostMapping("/{serviceName}/override")
    @Operation(summary = "Release check with an override", description = "override_reason is required")
    @PreAuthorize("hasAnyRole('RELEASE_PIPELINE', 'RELIABILITY_ADMIN')")
    public ResponseEntity<ReleaseDecisionResponse> override(
            @PathVariable String serviceName,
            @Valid @RequestBody OverrideRequest request) {
        return ResponseEntity.ok(releaseGateService.override(serviceName, request));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Release decision statistics")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<ReleaseStatisticsResponse> statistics(
            @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days) {
        return ResponseEntity.ok(releaseGateService.statistics(days));
    }

    @GetMapping("/{serviceName}")
    @Operation(summary = "Current gate state (not recorded) and recent decisions")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<ReleaseStatusResponse> status(
            @PathVariable String serviceName,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(releaseGateService.currentStatus(serviceName, limit));
    }
}
