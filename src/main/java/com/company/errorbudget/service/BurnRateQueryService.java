package com.company.errorbudget.service;

import com.company.errorbudget.cache.RedisSnapshotCache;
import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.dto.request.ComputeBurnRequest;
import com.company.errorbudget.dto.response.BurnHistoryResponse;
import com.company.errorbudget.dto.response.BurnRateResponse;
import com.company.errorbudget.dto.response.ComputeBurnResponse;
import com.company.errorbudget.repository.BurnRateSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Read side of evaluation results, plus on-demand evaluation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BurnRateQueryService {

    private static final Comparator<BurnRateSnapshot> SEVERITY_ORDER = Comparator
            .comparing((BurnRateSnapshot s) -> s.getRiskLevel().getRank())
            .thenComparingDouble(BurnRateSnapshot::getCompositeBurnRate)
            .thenComparing(Comparator.comparingDouble(BurnRateSnapshot::getErrorBudgetRemaining).reversed());

    private final BurnRateSnapshotRepository snapshotRepository;
    private final RedisSnapshotCache snapshotCache;
    private final ServiceCatalogService serviceCatalog;
    private final EvaluationScheduler evaluationScheduler;
    private final Clock clock;

    /**
     * Last completed snapshot of each active target; cache first, database on miss.
     */
    public List<BurnRateSnapshot> latestSnapshots(MonitoredService service) {
        Optional<List<BurnRateSnapshot>> cached = snapshotCache.getLatest(service.getServiceId());
        if (cached.isPresent()) {
            return cached.get();
        }
        log.debug("Snapshot cache miss for {}, reading database", service.getName());
        return snapshotRepository.findLatestByService(service.getServiceId());
    }

    /**
     * Snapshot of the target in the worst state, null before the first evaluation.
     */
    public BurnRateSnapshot worstLatestSnapshot(MonitoredService service) {
        return worstOf(latestSnapshots(service));
    }

    public static BurnRateSnapshot worstOf(Collection<BurnRateSnapshot> snapshots) {
        return snapshots.stream().max(SEVERITY_ORDER).orElse(null);
    }

    public List<BurnRateResponse> getCurrentBurnRates() {
        return snapshotRepository.findLatestForActiveServices().stream()
                .sorted(SEVERITY_ORDER.reversed())
                .map(BurnRateResponse::from)
                .collect(Collectors.toList());
    }

    public BurnHistoryResponse getHistory(String serviceName, int hours) {
        MonitoredService service = serviceCatalog.requireService(serviceName);
        Instant since = Instant.now(clock).minus(Duration.ofHours(hours));

        List<BurnRateSnapshot> history = snapshotRepository.findByServiceSince(service.getServiceId(), since);

        DoubleSummaryStatistics stats = history.stream()
                .mapToDouble(BurnRateSnapshot::getCompositeBurnRate)
                .summaryStatistics();

        return BurnHistoryResponse.builder()
                .serviceName(service.getName())
                .periodHours(hours)
                .latest(latestSnapshots(service).stream().map(BurnRateResponse::from).collect(Collectors.toList()))
                .history(history.stream().map(BurnRateResponse::from).collect(Collectors.toList()))
                .averageCompositeBurnRate(history.isEmpty() ? 0.0 : stats.getAverage())
                .peakCompositeBurnRate(history.isEmpty() ? 0.0 : stats.getMax())
                .build();
    }

    /**
     * Evaluates one service, or all active services, now. Runs through the scheduler
     * so the per-service single-flight rule still holds.
     */
    public ComputeBurnResponse compute(ComputeBurnRequest request) {
        List<MonitoredService> services = request != null && request.getServiceName() != null
                ? List.of(serviceCatalog.requireService(request.getServiceName()))
                : serviceCatalog.findActiveServices();

        if (services.size() == 1) {
            List<BurnRateSnapshot> snapshots = evaluationScheduler.submitAndWait(services.get(0));
            return ComputeBurnResponse.builder()
                    .servicesEvaluated(1)
                    .snapshots(snapshots.stream().map(BurnRateResponse::from).collect(Collectors.toList()))
                    .failures(Map.of())
                    .build();
        }

        Map<String, CompletableFuture<List<BurnRateSnapshot>>> futures = new LinkedHashMap<>();
        for (MonitoredService service : services) {
            futures.put(service.getName(), evaluationScheduler.submit(service));
        }

        List<BurnRateResponse> snapshots = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        futures.forEach((name, future) -> {
            try {
                future.join().forEach(s -> snapshots.add(BurnRateResponse.from(s)));
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("On-demand evaluation of {} failed: {}", name, cause.getMessage());
                failures.put(name, cause.getMessage());
            }
        });

        return ComputeBurnResponse.builder()
                .servicesEvaluated(services.size() - failures.size())
                .snapshots(snapshots)
                .failures(failures)
                .build();
    }
}
