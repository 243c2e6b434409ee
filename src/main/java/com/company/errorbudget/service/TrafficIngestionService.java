package com.company.errorbudget.service;

import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.TrafficSample;
import com.company.errorbudget.dto.request.IngestTrafficRequest;
import com.company.errorbudget.dto.request.TrafficSampleRequest;
import com.company.errorbudget.dto.response.IngestResponse;
import com.company.errorbudget.dto.response.TrafficSampleResponse;
import com.company.errorbudget.exception.ServiceNotFoundException;
import com.company.errorbudget.repository.TrafficSampleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Accepts traffic samples. Bad items are rejected individually; the rest of the
 * batch is stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrafficIngestionService {

    private static final int MAX_REPORTED_ERRORS = 50;

    private final ServiceCatalogService serviceCatalog;
    private final TrafficSampleRepository trafficSampleRepository;
    private final MeterRegistry meterRegistry;

    public IngestResponse ingest(IngestTrafficRequest request) {
        Map<String, Optional<MonitoredService>> resolved = new HashMap<>();
        List<TrafficSample> accepted = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        int index = 0;
        for (TrafficSampleRequest item : request.getSamples()) {
            String problem = validate(item);
            if (problem == null) {
                Optional<MonitoredService> service = resolved.computeIfAbsent(item.getService(), this::lookup);
                if (service.isPresent()) {
                    accepted.add(toSample(service.get(), item));
                } else {
                    problem = "unknown service " + item.getService();
                }
            }
            if (problem != null && errors.size() < MAX_REPORTED_ERRORS) {
                errors.add("samples[" + index + "]: " + problem);
            }
            index++;
        }

        int stored = accepted.isEmpty() ? 0 : trafficSampleRepository.saveAll(accepted);
        int rejected = request.getSamples().size() - accepted.size();

        meterRegistry.counter("errorbudget.ingest.samples", "result", "accepted").increment(accepted.size());
        meterRegistry.counter("errorbudget.ingest.samples", "result", "rejected").increment(rejected);

        if (rejected > 0) {
            log.warn("Ingested {} samples, rejected {}", stored, rejected);
        } else {
            log.debug("Ingested {} samples", stored);
        }

        return IngestResponse.builder()
                .processed(accepted.size())
                .rejected(rejected)
                .errors(errors)
                .build();
    }

    public List<TrafficSampleResponse> recentSamples(String serviceName, int limit) {
        MonitoredService service = serviceCatalog.requireService(serviceName);
        return trafficSampleRepository.findRecent(service.getServiceId(), limit).stream()
                .map(TrafficSampleResponse::from)
                .collect(Collectors.toList());
    }

    String validate(TrafficSampleRequest item) {
        if (item.getService() == null || item.getService().isBlank()) {
            return "service is required";
        }
        if (item.getTimestamp() == null) {
            return "timestamp is required";
        }
        if (item.getErrorCount() == null || item.getErrorCount() < 0) {
            return "error_count must be zero or positive";
        }
        if (item.getSuccessCount() == null && item.getTotalRequests() == null) {
            return "success_count or total_requests is required";
        }
        if (item.getSuccessCount() != null && item.getSuccessCount() < 0) {
            return "success_count must be zero or positive";
        }
        if (item.getSuccessCount() == null && item.getTotalRequests() < item.getErrorCount()) {
            return "error_count exceeds total_requests";
        }
        if (item.getSuccessCount() != null && item.getTotalRequests() != null
                && item.getSuccessCount() + item.getErrorCount() != item.getTotalRequests()) {
            return "success_count + error_count does not match total_requests";
        }
        return null;
    }

    private Optional<MonitoredService> lookup(String name) {
        try {
            return Optional.of(serviceCatalog.requireService(name));
        } catch (ServiceNotFoundException e) {
            return Optional.empty();
        }
    }

    private static TrafficSample toSample(MonitoredService service, TrafficSampleRequest item) {
        long success = item.getSuccessCount() != null
                ? item.getSuccessCount()
                : item.getTotalRequests() - item.getErrorCount();
        return TrafficSample.builder()
                .serviceId(service.getServiceId())
                .timestamp(item.getTimestamp())
                .successCount(success)
                .errorCount(item.getErrorCount())
                .build();
    }
}
