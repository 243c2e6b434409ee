package com.company.errorbudget.controller;

import com.company.errorbudget.dto.response.ForecastResponse;
import com.company.errorbudget.service.ForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/forecast")
@Tag(name = "Forecast", description = "Error budget exhaustion forecasts")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class ForecastController {

    private final ForecastService forecastService;

    @GetMapping
    @Operation(summary = "Forecasts of all active services, nearest exhaustion first")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<List<ForecastResponse>> getAllForecasts() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(forecastService.getAllForecasts());
    }

    @GetMapping("/{serviceName}")
    @Operation(summary = "Forecast of one service")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<ForecastResponse> getForecast(@PathVariable String serviceName) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(forecastService.getForecast(serviceName));
    }
}
