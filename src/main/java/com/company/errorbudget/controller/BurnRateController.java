package com.company.errorbudget.controller;

import com.company.errorbudget.dto.request.ComputeBurnRequest;
import com.company.errorbudget.dto.response.BurnHistoryResponse;
import com.company.errorbudget.dto.response.BurnRateResponse;
import com.company.errorbudget.dto.response.ComputeBurnResponse;
import com.company.errorbudget.service.BurnRateQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/burn")
@Tag(name = "Burn Rate", description = "Multi-window burn rates and on-demand evaluation")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class BurnRateController {

    private final BurnRateQueryService burnRateQueryService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "Latest snapshot of every active SLO target, worst first")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<List<BurnRateResponse>> getCurrent() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(15, TimeUnit.SECONDS).cachePrivate())
                .body(burnRateQueryService.getCurrentBurnRates());
    }

    @GetMapping("/{serviceName}")
    @Operation(summary = "Burn rate history of a service with average and peak")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<BurnHistoryResponse> getHistory(
            @PathVariable String serviceName,
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours) {
        return ResponseEntity.ok(burnRateQueryService.getHistory(serviceName, hours));
    }

    @PostMapping("/compute")
    @Operation(summary = "Evaluate now",
            description = "Runs an evaluation tick for one service, or all active services when none is named")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<ComputeBurnResponse> compute(@RequestBody(required = false) ComputeBurnRequest request) {
        meterRegistry.counter("api.burn.compute.requests",
                "scope", request != null && request.getServiceName() != null ? "service" : "all"
        ).increment();
        return ResponseEntity.ok(burnRateQueryService.compute(request));
    }
}
