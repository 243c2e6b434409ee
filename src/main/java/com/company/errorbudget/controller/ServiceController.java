package com.company.errorbudget.controller;

import com.company.errorbudget.dto.request.CreateServiceRequest;
import com.company.errorbudget.dto.request.UpdateServiceRequest;
import com.company.errorbudget.dto.response.ServiceResponse;
import com.company.errorbudget.service.ServiceCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/services")
@Tag(name = "Services", description = "Register and manage monitored services")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class ServiceController {

    private final ServiceCatalogService serviceCatalog;

    @GetMapping
    @Operation(summary = "List monitored services with their SLO targets")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<List<ServiceResponse>> listServices(
            @Parameter(description = "Include deactivated services")
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(serviceCatalog.listServices(includeInactive));
    }

    @GetMapping("/{serviceName}")
    @Operation(summary = "Get a service by name")
    @PreAuthorize("hasAnyRole('RELIABILITY_READER', 'RELIABILITY_ADMIN', 'RELEASE_PIPELINE')")
    public ResponseEntity<ServiceResponse> getService(@PathVariable String serviceName) {
        return ResponseEntity.ok(serviceCatalog.getService(serviceName));
    }

    @PostMapping
    @Operation(summary = "Register a service",
            description = "Creates a default availability SLO (99.9% over 30 days) when no targets are given")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<ServiceResponse> createService(@Valid @RequestBody CreateServiceRequest request) {
        log.info("Registering service {}", request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(serviceCatalog.createService(request));
    }

    @PutMapping("/{serviceName}")
    @Operation(summary = "Update service metadata")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<ServiceResponse> updateService(
            @PathVariable String serviceName,
            @Valid @RequestBody UpdateServiceRequest request) {
        return ResponseEntity.ok(serviceCatalog.updateService(serviceName, request));
    }

    @DeleteMapping("/{serviceName}")
    @Operation(summary = "Deactivate a service", description = "History is kept; the service stops being evaluated")
    @PreAuthorize("hasRole('RELIABILITY_ADMIN')")
    public ResponseEntity<Void> deactivateService(@PathVariable String serviceName) {
        serviceCatalog.deactivateService(serviceName);
        return ResponseEntity.noContent().build();
    }
}
