package com.company.errorbudget.controller;

import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.dto.request.AcknowledgeAlertRequest;
import com.company.errorbudget.dto.request.BulkAcknowledgeRequest;
import com.company.errorbudget.dto.response.AcknowledgeResponse;
import com.company.errorbudget.dto.response.AlertFeedResponse;
import com.company.errorbudget.dto.response.AlertResponse;
import com.company.errorbudget.dto.response.AlertStatisticsResponse;
import com.company.errorbudget.security.CallerContext;
import com.company.errorbudget.service.AlertManagerService;
import com.company.errorbudget.service.ServiceCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert feed and acknowledgement")
@RequiredArgsConstructor
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class AlertController {

    private final AlertManagerService alertManager;
    private final ServiceCatalogService serviceCatalog;
    private final CallerContext callerContext;

    @GetMapping
    @Operation(summary = "Alert feed, newest first")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<AlertFeedResponse> getFeed(
            @Parameter(description = "INFO, WARNING, CRITICAL or EMERGENCY")
            @RequestParam(required = false) AlertSeverity severity,
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(alertManager.getFeed(null, severity, acknowledged, hours, limit));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Alert counts by severity")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<AlertStatisticsResponse> getStatistics(
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours) {
        return ResponseEntity.ok(alertManager.getStatistics(hours));
    }

    @GetMapping("/{serviceName}")
    @Operation(summary = "Alert feed of one service")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<AlertFeedResponse> getServiceFeed(
            @PathVariable String serviceName,
            @RequestParam(required = false) AlertSeverity severity,
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit) {
        Long serviceId = serviceCatalog.requireService(serviceName).getServiceId();
        return ResponseEntity.ok(alertManager.getFeed(serviceId, severity, acknowledged, hours, limit));
    }

    @PatchMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an alert", description = "Idempotent")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<AlertResponse> acknowledge(
            @PathVariable Long alertId,
            @Valid @RequestBody(required = false) AcknowledgeAlertRequest request) {
        String by = callerContext.resolve(request != null ? request.getAcknowledgedBy() : null);
        return ResponseEntity.ok(alertManager.acknowledge(alertId, by));
    }

    @PostMapping("/acknowledge-bulk")
    @Operation(summary = "Acknowledge several alerts")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<AcknowledgeResponse> acknowledgeBulk(@Valid @RequestBody BulkAcknowledgeRequest request) {
        String by = callerContext.resolve(request.getAcknowledgedBy());
        return ResponseEntity.ok(alertManager.acknowledgeBulk(request.getAlertIds(), by));
    }
}
