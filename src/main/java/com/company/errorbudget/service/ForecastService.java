package com.company.errorbudget.service;

import com.company.errorbudget.config.RedisCacheConfig;
import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.Forecast;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.dto.response.ForecastResponse;
import com.company.errorbudget.engine.BudgetPoint;
import com.company.errorbudget.engine.ForecastingEngine;
import com.company.errorbudget.repository.BurnRateSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exhaustion forecasts, fitted over the recent snapshots of the service's worst target.
 */
@Service
@Slf4j
public class ForecastService {

    private static final Comparator<ForecastResponse> NEAREST_EXHAUSTION_FIRST = Comparator.comparing(
            ForecastResponse::getTimeToExhaustionHours, Comparator.nullsLast(Comparator.naturalOrder()));

    private final BurnRateSnapshotRepository snapshotRepository;
    private final BurnRateQueryService burnRateQueryService;
    private final ServiceCatalogService serviceCatalog;
    private final ForecastingEngine forecastingEngine;
    private final Clock clock;
    private final int historySize;

    public ForecastService(BurnRateSnapshotRepository snapshotRepository,
                           BurnRateQueryService burnRateQueryService,
                           ServiceCatalogService serviceCatalog,
                           ForecastingEngine forecastingEngine,
                           Clock clock,
                           @Value("${errorbudget.forecast.history-size:48}") int historySize) {
        this.snapshotRepository = snapshotRepository;
        this.burnRateQueryService = burnRateQueryService;
        this.serviceCatalog = serviceCatalog;
        this.forecastingEngine = forecastingEngine;
        this.clock = clock;
        this.historySize = historySize;
    }

    public Forecast forecast(MonitoredService service) {
        return forecast(service, burnRateQueryService.worstLatestSnapshot(service));
    }

    /**
     * @param basis snapshot whose target's history is fitted; null before the first evaluation
     */
    public Forecast forecast(MonitoredService service, BurnRateSnapshot basis) {
        Instant now = Instant.now(clock);
        if (basis == null) {
            return forecastingEngine.forecast(service.getName(), List.of(), 0.0, now);
        }

        List<BudgetPoint> history = snapshotRepository.findRecentByTarget(basis.getSloTargetId(), historySize)
                .stream()
                .map(s -> new BudgetPoint(s.getEvaluatedAt(), s.getErrorBudgetRemaining()))
                .collect(Collectors.toList());

        return forecastingEngine.forecast(service.getName(), history, basis.getCompositeBurnRate(), now);
    }

    @Cacheable(value = RedisCacheConfig.FORECASTS, key = "#serviceName")
    public ForecastResponse getForecast(String serviceName) {
        return ForecastResponse.from(forecast(serviceCatalog.requireService(serviceName)));
    }

    public List<ForecastResponse> getAllForecasts() {
        List<ForecastResponse> forecasts = serviceCatalog.findActiveServices().stream()
                .map(s -> ForecastResponse.from(forecast(s)))
                .sorted(NEAREST_EXHAUSTION_FIRST)
                .collect(Collectors.toList());

        log.debug("Computed {} forecasts", forecasts.size());
        return forecasts;
    }
}
