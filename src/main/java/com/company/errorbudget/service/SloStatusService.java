package com.company.errorbudget.service;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.ErrorBudgetLedgerEntry;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.domain.enums.EvaluationWindow;
import com.company.errorbudget.dto.response.SloStatusResponse;
import com.company.errorbudget.engine.ErrorBudgetLedger;
import com.company.errorbudget.engine.WindowRate;
import com.company.errorbudget.repository.ErrorBudgetLedgerRepository;
import com.company.errorbudget.repository.SloTargetRepository;
import com.company.errorbudget.repository.TrafficSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compliance of each active target over its current compliance window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SloStatusService {

    private final ServiceCatalogService serviceCatalog;
    private final SloTargetRepository sloTargetRepository;
    private final TrafficSampleRepository trafficSampleRepository;
    private final ErrorBudgetLedgerRepository ledgerRepository;
    private final BurnRateQueryService burnRateQueryService;
    private final ErrorBudgetLedger errorBudgetLedger;
    private final Clock clock;

    public SloStatusResponse getStatus(String serviceName) {
        MonitoredService service = serviceCatalog.requireService(serviceName);
        Instant now = Instant.now(clock);

        Map<Long, BurnRateSnapshot> latestByTarget = burnRateQueryService.latestSnapshots(service).stream()
                .collect(Collectors.toMap(BurnRateSnapshot::getSloTargetId, Function.identity(), (a, b) -> a));

        List<SloStatusResponse.TargetStatus> statuses = new ArrayList<>();
        for (SloTarget target : sloTargetRepository.findActiveByServiceId(service.getServiceId())) {
            statuses.add(targetStatus(service, target, latestByTarget.get(target.getTargetId()), now));
        }

        return SloStatusResponse.builder()
                .serviceName(service.getName())
                .evaluatedAt(now)
                .targets(statuses)
                .build();
    }

    private SloStatusResponse.TargetStatus targetStatus(MonitoredService service, SloTarget target,
                                                        BurnRateSnapshot latest, Instant now) {
        Instant windowStart = errorBudgetLedger.windowStartFor(target, now);
        Instant windowEnd = windowStart.plus(target.complianceWindow());

        // A ledger from an earlier window has not been rolled over yet
        ErrorBudgetLedgerEntry entry = ledgerRepository.find(service.getServiceId(), target.getTargetId())
                .filter(e -> !e.getWindowStart().isBefore(windowStart))
                .orElse(null);
        double consumed = errorBudgetLedger.consumedPercentage(
                entry != null ? entry.getConsumedErrorHours() : 0.0,
                errorBudgetLedger.totalBudgetErrorHours(target));

        Long serviceId = service.getServiceId();
        Double availability = trafficSampleRepository.sumBetween(serviceId, windowStart, now).availability();

        return SloStatusResponse.TargetStatus.builder()
                .targetId(target.getTargetId())
                .name(target.getName())
                .targetValue(target.getTargetValue())
                .windowDays(target.getWindowDays())
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .currentAvailability(availability)
                .meetingSlo(availability == null || availability >= target.getTargetValue())
                .errorBudgetConsumed(consumed)
                .errorBudgetRemaining(errorBudgetLedger.remainingPercentage(consumed))
                .availability5m(availabilityOver(serviceId, EvaluationWindow.FIVE_MINUTES, now))
                .availability1h(availabilityOver(serviceId, EvaluationWindow.ONE_HOUR, now))
                .availability24h(availabilityOver(serviceId, EvaluationWindow.TWENTY_FOUR_HOURS, now))
                .riskLevel(latest != null ? latest.getRiskLevel() : null)
                .lastEvaluatedAt(latest != null ? latest.getEvaluatedAt() : null)
                .build();
    }

    private Double availabilityOver(Long serviceId, EvaluationWindow window, Instant now) {
        WindowRate rate = trafficSampleRepository.sumBetween(serviceId, now.minus(window.getDuration()), now);
        return rate.availability();
    }
}
