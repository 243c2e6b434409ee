package com.company.errorbudget.controller;

import com.company.errorbudget.dto.request.SloTargetRequest;
import com.company.errorbudget.dto.response.SloStatusResponse;
import com.company.errorbudget.dto.response.SloTargetResponse;
import com.company.errorbudget.service.SloStatusService;
import com.company.errorbudget.service.SloTargetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/slo")
@Tag(name = "SLO", description = "SLO targets and compliance status")
@RequiredArgsConstructor
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class SloController {

    private final SloStatusService statusService;
    private final SloTargetService targetService;

    @GetMapping("/{serviceName}")
    @Operation(summary = "Compliance of each SLO target over its current window")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<SloStatusResponse> getStatus(@PathVariable String serviceName) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(15, TimeUnit.SECONDS).cachePrivate())
                .body(statusService.getStatus(serviceName));
    }

    @GetMapping("/{serviceName}/targets")
    @Operation(summary = "List SLO targets of a service")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<List<SloTargetResponse>> listTargets(@PathVariable String serviceName) {
        return ResponseEntity.ok(targetService.listTargets(serviceName));
    }

    @PostMapping("/{serviceName}/targets")
    @Operation(summary = "Add an SLO target to a service")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<SloTargetResponse> createTarget(
            @PathVariable String serviceName,
            @Valid @RequestBody SloTargetRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(targetService.createTarget(serviceName, request));
    }

    @PutMapping("/targets/{targetId}")
    @Operation(summary = "Update an SLO target", description = "Only the fields present are changed")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<SloTargetResponse> updateTarget(
            @PathVariable Long targetId,
            @Valid @RequestBody SloTargetRequest request) {
        return ResponseEntity.ok(targetService.updateTarget(targetId, request));
    }
}
