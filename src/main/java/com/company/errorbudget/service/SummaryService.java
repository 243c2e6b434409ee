package com.company.errorbudget.service;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.Forecast;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.BurnRateTrend;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.dto.response.*;
import com.company.errorbudget.engine.ReleaseCheckCommand;
import com.company.errorbudget.engine.ReleaseGateEvaluator;
import com.company.errorbudget.repository.AlertRepository;
import com.company.errorbudget.repository.BurnRateSnapshotRepository;
import com.company.errorbudget.security.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Platform and per-service roll-ups for dashboards.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryService {

    static final String HEALTHY = "healthy";
    static final String DEGRADED = "degraded";
    static final String CRITICAL = "critical";

    private static final int OPEN_ALERT_LIMIT = 20;

    private final ServiceCatalogService serviceCatalog;
    private final BurnRateQueryService burnRateQueryService;
    private final BurnRateSnapshotRepository snapshotRepository;
    private final ForecastService forecastService;
    private final ReleaseGateEvaluator gateEvaluator;
    private final AlertRepository alertRepository;
    private final CallerContext callerContext;
    private final Clock clock;

    public PlatformSummaryResponse overview() {
        List<MonitoredService> services = serviceCatalog.findActiveServices();

        Map<Long, BurnRateSnapshot> worstByService = snapshotRepository.findLatestForActiveServices().stream()
                .collect(Collectors.groupingBy(BurnRateSnapshot::getServiceId)).entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> BurnRateQueryService.worstOf(e.getValue())));

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (RiskLevel level : RiskLevel.values()) {
            distribution.put(level.name(), 0);
        }

        double scoreTotal = 0.0;
        double remainingTotal = 0.0;
        int evaluated = 0;
        BurnRateSnapshot lowest = null;
        List<ForecastResponse> forecasts = new ArrayList<>();

        for (MonitoredService service : services) {
            BurnRateSnapshot worst = worstByService.get(service.getServiceId());
            Forecast forecast = forecastService.forecast(service, worst);
            forecasts.add(ForecastResponse.from(forecast));

            RiskLevel risk = worst != null ? worst.getRiskLevel() : RiskLevel.SAFE;
            distribution.merge(risk.name(), 1, Integer::sum);
            scoreTotal += healthScore(worst, forecast);

            if (worst != null) {
                evaluated++;
                remainingTotal += worst.getErrorBudgetRemaining();
                if (lowest == null || worst.getErrorBudgetRemaining() < lowest.getErrorBudgetRemaining()) {
                    lowest = worst;
                }
            }
        }

        ForecastResponse nearest = forecasts.stream()
                .filter(f -> f.getTimeToExhaustionHours() != null)
                .min(Comparator.comparing(ForecastResponse::getTimeToExhaustionHours))
                .orElse(null);

        double score = services.isEmpty() ? 100.0 : scoreTotal / services.size();

        return PlatformSummaryResponse.builder()
                .generatedAt(Instant.now(clock))
                .totalServices(services.size())
                .riskDistribution(distribution)
                .averageBudgetRemaining(evaluated > 0 ? remainingTotal / evaluated : 100.0)
                .lowestBudgetRemaining(lowest != null ? lowest.getErrorBudgetRemaining() : null)
                .lowestBudgetService(lowest != null ? lowest.getServiceName() : null)
                .nearestExhaustion(nearest)
                .activeAlerts(alertRepository.countUnacknowledged())
                .criticalAlerts(alertRepository.countUnacknowledgedAtLeast(AlertSeverity.CRITICAL))
                .overallHealth(healthOf(score))
                .build();
    }

    public ServiceSummaryResponse serviceSummary(String serviceName) {
        MonitoredService service = serviceCatalog.requireService(serviceName);
        Instant now = Instant.now(clock);

        List<BurnRateSnapshot> latest = burnRateQueryService.latestSnapshots(service);
        BurnRateSnapshot worst = BurnRateQueryService.worstOf(latest);
        Forecast forecast = forecastService.forecast(service, worst);

        ReleaseCheckCommand dryRun = ReleaseCheckCommand.builder()
                .serviceName(service.getName())
                .requestedBy(callerContext.getCurrentCaller())
                .build();
        ReleaseDecisionResponse gate = ReleaseDecisionResponse.from(
                gateEvaluator.evaluate(service, dryRun, worst, forecast, now));

        List<AlertResponse> openAlerts = alertRepository
                .findUnacknowledgedByService(service.getServiceId(), OPEN_ALERT_LIMIT).stream()
                .map(AlertResponse::from)
                .collect(Collectors.toList());

        return ServiceSummaryResponse.builder()
                .serviceName(service.getName())
                .tier(service.getTier())
                .ownerTeam(service.getOwnerTeam())
                .generatedAt(now)
                .riskLevel(worst != null ? worst.getRiskLevel() : null)
                .latestSnapshots(latest.stream().map(BurnRateResponse::from).collect(Collectors.toList()))
                .forecast(ForecastResponse.from(forecast))
                .releaseGate(gate)
                .openAlerts(openAlerts)
                .narrative(narrative(service, worst, forecast, gate, openAlerts.size()))
                .build();
    }

    /**
     * Highest risk recorded per service per bucket; SAFE where a bucket has no data.
     */
    public HeatmapResponse heatmap(int hours, int intervalHours) {
        Instant now = Instant.now(clock);
        Instant start = now.minus(Duration.ofHours(hours));
        Duration interval = Duration.ofHours(intervalHours);
        int bucketCount = (hours + intervalHours - 1) / intervalHours;

        List<Instant> buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(start.plus(interval.multipliedBy(i)));
        }

        Map<Long, RiskLevel[]> matrix = new HashMap<>();
        for (BurnRateSnapshot snapshot : snapshotRepository.findSince(start)) {
            int bucket = (int) (Duration.between(start, snapshot.getEvaluatedAt()).toMillis() / interval.toMillis());
            if (bucket < 0 || bucket >= bucketCount) {
                continue;
            }
            RiskLevel[] row = matrix.computeIfAbsent(snapshot.getServiceId(), id -> newRow(bucketCount));
            if (snapshot.getRiskLevel().isAtLeast(row[bucket])) {
                row[bucket] = snapshot.getRiskLevel();
            }
        }

        List<HeatmapResponse.Row> rows = serviceCatalog.findActiveServices().stream()
                .sorted(Comparator.comparing(MonitoredService::getName))
                .map(s -> HeatmapResponse.Row.builder()
                        .serviceName(s.getName())
                        .riskLevels(Arrays.asList(matrix.getOrDefault(s.getServiceId(), newRow(bucketCount))))
                        .build())
                .collect(Collectors.toList());

        return HeatmapResponse.builder()
                .hours(hours)
                .intervalHours(intervalHours)
                .buckets(buckets)
                .services(rows)
                .build();
    }

    /**
     * 0-100; deductions for exhaustion, fast burn, a low budget and a draining trend.
     */
    static double healthScore(BurnRateSnapshot worst, Forecast forecast) {
        if (worst == null) {
            return 100.0;
        }
        double score = 100.0;
        double remaining = worst.getErrorBudgetRemaining();
        double burn = worst.getCompositeBurnRate();

        if (remaining <= 0.0) {
            score -= 50.0;
        } else if (burn >= 3.0) {
            score -= 40.0;
        } else if (burn >= 1.5) {
            score -= 20.0;
        }
        if (remaining > 0.0 && remaining < 15.0) {
            score -= 15.0;
        }
        if (forecast != null && forecast.getBurnRateTrend() == BurnRateTrend.INCREASING) {
            score -= 5.0;
        }
        return Math.max(0.0, score);
    }

    static String healthOf(double score) {
        if (score >= 90.0) {
            return HEALTHY;
        }
        if (score >= 70.0) {
            return DEGRADED;
        }
        return CRITICAL;
    }

    String narrative(MonitoredService service, BurnRateSnapshot worst, Forecast forecast,
                     ReleaseDecisionResponse gate, int openAlerts) {
        if (worst == null) {
            return service.getName() + " has not been evaluated yet.";
        }

        StringBuilder text = new StringBuilder();
        text.append(String.format(Locale.ROOT, "%s is at risk level %s with a composite burn rate of %.2f and %.1f%% of its error budget remaining.",
                service.getName(), worst.getRiskLevel(), worst.getCompositeBurnRate(), worst.getErrorBudgetRemaining()));
        text.append(' ').append(forecast.getForecastMessage());
        text.append(' ').append(gate.isAllowed()
                ? "Releases are currently allowed."
                : "Releases are currently blocked.");
        if (openAlerts > 0) {
            text.append(' ').append(openAlerts == 1
                    ? "1 alert is awaiting acknowledgement."
                    : openAlerts + " alerts are awaiting acknowledgement.");
        }
        return text.toString();
    }

    private static RiskLevel[] newRow(int size) {
        RiskLevel[] row = new RiskLevel[size];
        Arrays.fill(row, RiskLevel.SAFE);
        return row;
    }
}
