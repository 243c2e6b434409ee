package com.company.errorbudget.service;

import com.company.errorbudget.cache.RedisSnapshotCache;
import com.company.errorbudget.domain.*;
import com.company.errorbudget.domain.enums.EvaluationWindow;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.engine.*;
import com.company.errorbudget.event.SnapshotEvaluatedEvent;
import com.company.errorbudget.exception.StaleEvaluationException;
import com.company.errorbudget.repository.*;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One evaluation tick: aggregates traffic, computes burn rates, accrues the error
 * budget ledger, classifies risk and stores the snapshot, then hands the result
 * to alerting.
 *
 * <p>Ledger and snapshot are written in one transaction while the ledger lock of
 * the (service, SLO) pair is held. Any failure leaves the previous ledger value
 * and the previous snapshot in place.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SloEvaluationService {

    private final SloTargetRepository sloTargetRepository;
    private final TrafficSampleRepository trafficSampleRepository;
    private final BurnRateSnapshotRepository snapshotRepository;
    private final ErrorBudgetLedgerRepository ledgerRepository;
    private final RedisSnapshotCache snapshotCache;
    private final WindowAggregator windowAggregator;
    private final BurnRateCalculator burnRateCalculator;
    private final ErrorBudgetLedger errorBudgetLedger;
    private final RiskClassifier riskClassifier;
    private final LedgerLocks ledgerLocks;
    private final AlertManagerService alertManager;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public List<BurnRateSnapshot> evaluateService(MonitoredService service, EvaluationTick tick) {
        MDC.put("service", service.getName());
        try {
            List<SloTarget> targets = sloTargetRepository.findActiveByServiceId(service.getServiceId());
            if (targets.isEmpty()) {
                log.debug("No active SLO targets for {}", service.getName());
                return List.of();
            }

            Instant now = Instant.now(clock);
            List<BurnRateSnapshot> snapshots = new ArrayList<>();
            for (SloTarget target : targets) {
                snapshots.add(evaluateTarget(service, target, tick, now));
            }
            return snapshots;
        } finally {
            MDC.remove("service");
        }
    }

    BurnRateSnapshot evaluateTarget(MonitoredService service, SloTarget target, EvaluationTick tick, Instant now) {
        try {
            TargetEvaluation evaluation = ledgerLocks.withLock(service.getServiceId(), target.getTargetId(),
                    () -> evaluateUnderLock(service, target, tick, now));

            // Still inside the tick's commit, so an abandon cannot slip in here
            BurnRateSnapshot snapshot = evaluation.snapshot;
            snapshotCache.put(snapshot);

            log.info("Evaluated {}/{}: composite={} risk={} budget remaining={}%",
                    service.getName(), target.getName(),
                    String.format("%.3f", snapshot.getCompositeBurnRate()),
                    snapshot.getRiskLevel(),
                    String.format("%.2f", snapshot.getErrorBudgetRemaining()));

            meterRegistry.counter("errorbudget.evaluation.snapshots",
                    "risk", snapshot.getRiskLevel().name()
            ).increment();

            eventPublisher.publishEvent(new SnapshotEvaluatedEvent(snapshot, evaluation.previousRisk));
            alertManager.onSnapshotEvaluated(service, target, evaluation.previousRisk, snapshot);
            return snapshot;
        } finally {
            tick.endCommit();
        }
    }

    private TargetEvaluation evaluateUnderLock(MonitoredService service, SloTarget target,
                                               EvaluationTick tick, Instant now) {
        ErrorBudgetLedgerEntry prior = ledgerRepository
                .find(service.getServiceId(), target.getTargetId())
                .orElse(null);

        RiskLevel previousRisk = snapshotRepository.findRecentByTarget(target.getTargetId(), 1).stream()
                .findFirst()
                .map(BurnRateSnapshot::getRiskLevel)
                .orElse(null);

        Instant longestWindowStart = now.minus(EvaluationWindow.longest());
        // the accrual reads the trailing five minutes before its start
        Instant accrualStart = errorBudgetLedger.accrualStart(prior, target, now)
                .minus(EvaluationWindow.FIVE_MINUTES.getDuration());
        Instant from = accrualStart.isBefore(longestWindowStart) ? accrualStart : longestWindowStart;

        List<TrafficSample> samples = new ArrayList<>(
                trafficSampleRepository.findBetween(service.getServiceId(), from, now));
        if (prior != null && prior.getLastSampleId() != null) {
            // Late arrivals older than the loaded range still count against this window
            Instant windowStart = errorBudgetLedger.windowStartFor(target, now);
            if (windowStart.isBefore(from)) {
                samples.addAll(trafficSampleRepository.findArrivedAfter(
                        service.getServiceId(), prior.getLastSampleId(), windowStart, from));
            }
        }

        Map<EvaluationWindow, WindowRate> rates = windowAggregator.aggregate(samples, now);
        BurnRateBreakdown burn = burnRateCalculator.calculate(rates, target.allowedErrorRate());
        LedgerAccrual accrual = errorBudgetLedger.accrue(prior, target, samples, now);
        RiskLevel risk = riskClassifier.classify(burn.getComposite(), riskClassifier.thresholdsFor(target));

        if (accrual.isRolledOver()) {
            log.info("Compliance window of {}/{} rolled over, budget reset (window starts {})",
                    service.getName(), target.getName(), accrual.getEntry().getWindowStart());
        }

        log.debug("{}/{} windows: 5m={} 1h={} 24h={}, accrued {} error-hours",
                service.getName(), target.getName(),
                rates.get(EvaluationWindow.FIVE_MINUTES),
                rates.get(EvaluationWindow.ONE_HOUR),
                rates.get(EvaluationWindow.TWENTY_FOUR_HOURS),
                accrual.getAccruedErrorHours());

        BurnRateSnapshot snapshot = BurnRateSnapshot.builder()
                .serviceId(service.getServiceId())
                .serviceName(service.getName())
                .sloTargetId(target.getTargetId())
                .evaluatedAt(now)
                .errorRate5m(rates.get(EvaluationWindow.FIVE_MINUTES).getErrorRate())
                .errorRate1h(rates.get(EvaluationWindow.ONE_HOUR).getErrorRate())
                .errorRate24h(rates.get(EvaluationWindow.TWENTY_FOUR_HOURS).getErrorRate())
                .burnRate5m(burn.getBurnRate5m())
                .burnRate1h(burn.getBurnRate1h())
                .burnRate24h(burn.getBurnRate24h())
                .compositeBurnRate(burn.getComposite())
                .errorBudgetConsumed(accrual.getConsumedPercentage())
                .errorBudgetRemaining(accrual.getRemainingPercentage())
                .riskLevel(risk)
                .build();

        transactionTemplate.executeWithoutResult(status -> {
            if (!tick.beginCommit()) {
                throw new StaleEvaluationException(service.getServiceId(), tick.getGeneration());
            }
            ledgerRepository.save(accrual.getEntry());
            snapshotRepository.save(snapshot);
        });

        return new TargetEvaluation(snapshot, previousRisk);
    }

    private static final class TargetEvaluation {
        private final BurnRateSnapshot snapshot;
        private final RiskLevel previousRisk;

        private TargetEvaluation(BurnRateSnapshot snapshot, RiskLevel previousRisk) {
            this.snapshot = snapshot;
            this.previousRisk = previousRisk;
        }
    }
}
