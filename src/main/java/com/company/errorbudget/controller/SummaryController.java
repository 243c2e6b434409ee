package com.company.errorbudget.controller;

import com.company.errorbudget.dto.response.HeatmapResponse;
import com.company.errorbudget.dto.response.PlatformSummaryResponse;
import com.company.errorbudget.dto.response.ServiceSummaryResponse;
import com.company.errorbudget.service.SummaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/summary")
@Tag(name = "Summary", description = "Dashboard roll-ups")
@RequiredArgsConstructor
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class SummaryController {

    private final SummaryService summaryService;

    @GetMapping
    @Operation(summary = "Platform overview")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<PlatformSummaryResponse> overview() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS).cachePrivate())
                .body(summaryService.overview());
    }

    @GetMapping("/heatmap")
    @Operation(summary = "Service x time matrix of the highest risk level per bucket")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<HeatmapResponse> heatmap(
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours,
            @RequestParam(name = "interval_hours", defaultValue = "1") @Min(1) @Max(168) int intervalHours) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(summaryService.heatmap(hours, Math.min(intervalHours, hours)));
    }

    @GetMapping("/{serviceName}")
    @Operation(summary = "Snapshot, forecast, gate state and open alerts of one service")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<ServiceSummaryResponse> serviceSummary(@PathVariable String serviceName) {
        return ResponseEntity.ok(summaryService.serviceSummary(serviceName));
    }
}
