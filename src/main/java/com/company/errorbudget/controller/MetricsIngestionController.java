package com.company.errorbudget.controller;

import com.company.errorbudget.dto.request.IngestTrafficRequest;
import com.company.errorbudget.dto.response.IngestResponse;
import com.company.errorbudget.dto.response.TrafficSampleResponse;
import com.company.errorbudget.service.TrafficIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Traffic", description = "Traffic sample ingestion")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class MetricsIngestionController {

    private final TrafficIngestionService ingestionService;

    @PostMapping("/ingest")
    @Operation(summary = "Ingest a batch of traffic samples",
            description = "Samples for unknown services are rejected individually")
    @PreAuthorize("hasAnyRole('RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody IngestTrafficRequest request) {
        log.debug("Ingest request with {} samples", request.getSamples().size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ingestionService.ingest(request));
    }

    @GetMapping("/{serviceName}")
    @Operation(summary = "Most recent traffic samples of a service")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<List<TrafficSampleResponse>> recentSamples(
            @PathVariable String serviceName,
            @RequestParam(defaultValue = "60") @Min(1) @Max(1440) int limit) {
        return ResponseEntity.ok(ingestionService.recentSamples(serviceName, limit));
    }
}
