package com.company.errorbudget.service;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.Forecast;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.ReleaseDecision;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.dto.request.OverrideRequest;
import com.company.errorbudget.dto.request.ReleaseCheckRequest;
import com.company.errorbudget.dto.response.ReleaseDecisionResponse;
import com.company.errorbudget.dto.response.ReleaseStatisticsResponse;
import com.company.errorbudget.dto.response.ReleaseStatusResponse;
import com.company.errorbudget.engine.ReleaseCheckCommand;
import com.company.errorbudget.engine.ReleaseGateEvaluator;
import com.company.errorbudget.repository.ReleaseDecisionRepository;
import com.company.errorbudget.security.CallerContext;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Release gate: decides from the last completed evaluation and records every
 * decision. Never triggers an evaluation itself.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReleaseGateService {

    private final ServiceCatalogService serviceCatalog;
    private final BurnRateQueryService burnRateQueryService;
    private final ForecastService forecastService;
    private final ReleaseGateEvaluator gateEvaluator;
    private final ReleaseDecisionRepository decisionRepository;
    private final CallerContext callerContext;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ReleaseDecisionResponse check(ReleaseCheckRequest request) {
        ReleaseCheckCommand command = ReleaseCheckCommand.builder()
                .serviceName(request.getServiceName())
                .deploymentId(request.getDeploymentId())
                .version(request.getVersion())
                .requestedBy(callerContext.resolve(request.getRequestedBy()))
                .override(request.isOverride())
                .overrideReason(request.getOverrideReason())
                .build();
        return ReleaseDecisionResponse.from(decide(command));
    }

    public ReleaseDecisionResponse override(String serviceName, OverrideRequest request) {
        ReleaseCheckCommand command = ReleaseCheckCommand.builder()
                .serviceName(serviceName)
                .deploymentId(request.getDeploymentId())
                .version(request.getVersion())
                .requestedBy(callerContext.resolve(request.getRequestedBy()))
                .override(true)
                .overrideReason(request.getOverrideReason())
                .build();
        return ReleaseDecisionResponse.from(decide(command));
    }

    ReleaseDecision decide(ReleaseCheckCommand command) {
        // Malformed requests are rejected before the service lookup
        gateEvaluator.validate(command);
        MonitoredService service = serviceCatalog.requireService(command.getServiceName());

        ReleaseDecision decision = evaluate(service, command);
        ReleaseDecision saved = decisionRepository.save(decision);

        meterRegistry.counter("errorbudget.release.decisions",
                "state", saved.getState().name(),
                "overridden", String.valueOf(saved.isOverridden())
        ).increment();

        if (saved.isOverridden()) {
            log.warn("Release {} of {} overridden by {} at risk {}: {}",
                    saved.getDeploymentId(), service.getName(), saved.getRequestedBy(),
                    saved.getRiskLevel(), saved.getOverrideReason());
        } else {
            log.info("Release {} of {} {} at risk {} (requested by {})",
                    saved.getDeploymentId(), service.getName(), saved.getState(),
                    saved.getRiskLevel(), saved.getRequestedBy());
        }
        return saved;
    }

    /**
     * Gate state a release would get now. Not recorded.
     */
    public ReleaseStatusResponse currentStatus(String serviceName, int limit) {
        MonitoredService service = serviceCatalog.requireService(serviceName);

        ReleaseCheckCommand dryRun = ReleaseCheckCommand.builder()
                .serviceName(service.getName())
                .requestedBy(callerContext.getCurrentCaller())
                .build();
        ReleaseDecision current = evaluate(service, dryRun);

        List<ReleaseDecisionResponse> recent = decisionRepository
                .findRecentByService(service.getServiceId(), limit).stream()
                .map(ReleaseDecisionResponse::from)
                .collect(Collectors.toList());

        return ReleaseStatusResponse.builder()
                .serviceName(service.getName())
                .current(ReleaseDecisionResponse.from(current))
                .recentDecisions(recent)
                .build();
    }

    public ReleaseStatisticsResponse statistics(int days) {
        Instant since = Instant.now(clock).minus(Duration.ofDays(days));
        List<ReleaseDecision> decisions = decisionRepository.findSince(since);

        int allowed = 0;
        int overrides = 0;
        Map<RiskLevel, Integer> byRisk = new EnumMap<>(RiskLevel.class);
        for (ReleaseDecision decision : decisions) {
            if (decision.isAllowed()) {
                allowed++;
            }
            if (decision.isOverridden()) {
                overrides++;
            }
            byRisk.merge(decision.getRiskLevel(), 1, Integer::sum);
        }

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (RiskLevel level : RiskLevel.values()) {
            distribution.put(level.name(), byRisk.getOrDefault(level, 0));
        }

        int total = decisions.size();
        int blocked = total - allowed;
        return ReleaseStatisticsResponse.builder()
                .periodDays(days)
                .totalChecks(total)
                .allowed(allowed)
                .blocked(blocked)
                .overrides(overrides)
                .blockRate(total > 0 ? (double) blocked / total : 0.0)
                .riskDistribution(distribution)
                .build();
    }

    private ReleaseDecision evaluate(MonitoredService service, ReleaseCheckCommand command) {
        BurnRateSnapshot snapshot = burnRateQueryService.worstLatestSnapshot(service);
        Forecast forecast = forecastService.forecast(service, snapshot);
        return gateEvaluator.evaluate(service, command, snapshot, forecast, Instant.now(clock));
    }
}
