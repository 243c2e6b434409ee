package com.company.errorbudget.service;

import com.company.errorbudget.cache.RedisSnapshotCache;
import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.ErrorBudgetLedgerEntry;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.domain.TrafficSample;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.engine.BurnRateCalculator;
import com.company.errorbudget.engine.ErrorBudgetLedger;
import com.company.errorbudget.engine.RiskClassifier;
import com.company.errorbudget.engine.WindowAggregator;
import com.company.errorbudget.event.SnapshotEvaluatedEvent;
import com.company.errorbudget.exception.StaleEvaluationException;
import com.company.errorbudget.repository.BurnRateSnapshotRepository;
import com.company.errorbudget.repository.ErrorBudgetLedgerRepository;
import com.company.errorbudget.repository.SloTargetRepository;
import com.company.errorbudget.repository.TrafficSampleRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SloEvaluationService")
class SloEvaluationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SloTargetRepository sloTargetRepository;
    @Mock
    private TrafficSampleRepository trafficSampleRepository;
    @Mock
    private BurnRateSnapshotRepository snapshotRepository;
    @Mock
    private ErrorBudgetLedgerRepository ledgerRepository;
    @Mock
    private RedisSnapshotCache snapshotCache;
    @Mock
    private AlertManagerService alertManager;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private PlatformTransactionManager transactionManager;

    private SloEvaluationService evaluationService;

    private final MonitoredService service = MonitoredService.builder()
            .serviceId(1L).name("checkout").tier(1).active(true).build();
    private final SloTarget target = SloTarget.builder()
            .targetId(10L).serviceId(1L).name("availability").targetValue(99.9).windowDays(30)
            .active(true).createdAt(NOW.minus(Duration.ofHours(1))).build();

    @BeforeEach
    void setUp() {
        evaluationService = new SloEvaluationService(
                sloTargetRepository, trafficSampleRepository, snapshotRepository, ledgerRepository,
                snapshotCache, new WindowAggregator(), new BurnRateCalculator(),
                new ErrorBudgetLedger(new WindowAggregator()), new RiskClassifier(),
                new LedgerLocks(1000), alertManager, new TransactionTemplate(transactionManager),
                eventPublisher, new SimpleMeterRegistry(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a service without active targets produces no snapshots")
    void noTargets() {
        when(sloTargetRepository.findActiveByServiceId(1L)).thenReturn(List.of());

        List<BurnRateSnapshot> snapshots = evaluationService.evaluateService(service, tick());

        assertThat(snapshots).isEmpty();
        verify(trafficSampleRepository, never()).findBetween(any(), any(), any());
    }

    @Nested
    @DisplayName("a completed tick")
    class CompletedTick {

        @BeforeEach
        void traffic() {
            when(sloTargetRepository.findActiveByServiceId(1L)).thenReturn(List.of(target));
            when(ledgerRepository.find(1L, 10L)).thenReturn(Optional.empty());
            when(trafficSampleRepository.findBetween(eq(1L), any(Instant.class), eq(NOW)))
                    .thenReturn(List.of(sample(NOW.minusSeconds(120), 990, 10)));
        }

        @Test
        @DisplayName("computes burn rates, budget and risk from the samples")
        void computesSnapshot() {
            when(snapshotRepository.findRecentByTarget(10L, 1)).thenReturn(List.of());

            List<BurnRateSnapshot> snapshots = evaluationService.evaluateService(service, tick());

            assertThat(snapshots).hasSize(1);
            BurnRateSnapshot snapshot = snapshots.get(0);
            assertThat(snapshot.getEvaluatedAt()).isEqualTo(NOW);
            assertThat(snapshot.getErrorRate5m()).isCloseTo(0.01, within(1e-9));
            assertThat(snapshot.getBurnRate5m()).isCloseTo(10.0, within(1e-6));
            assertThat(snapshot.getCompositeBurnRate()).isCloseTo(10.0, within(1e-6));
            assertThat(snapshot.getRiskLevel()).isEqualTo(RiskLevel.FREEZE);
            // the sample's first two minutes at 1% errors against a 0.72 error-hour budget
            assertThat(snapshot.getErrorBudgetConsumed()).isCloseTo(0.0463, within(1e-4));
            assertThat(snapshot.getErrorBudgetRemaining()).isCloseTo(99.9537, within(1e-4));
        }

        @Test
        @DisplayName("writes ledger and snapshot, refreshes the cache and notifies alerting")
        void persistsAndNotifies() {
            when(snapshotRepository.findRecentByTarget(10L, 1)).thenReturn(List.of());

            BurnRateSnapshot snapshot = evaluationService.evaluateService(service, tick()).get(0);

            ArgumentCaptor<ErrorBudgetLedgerEntry> ledger = ArgumentCaptor.forClass(ErrorBudgetLedgerEntry.class);
            verify(ledgerRepository).save(ledger.capture());
            assertThat(ledger.getValue().getLastAccruedAt()).isEqualTo(NOW);
            assertThat(ledger.getValue().getConsumedErrorHours()).isCloseTo(0.01 * 2 / 60, within(1e-12));

            verify(snapshotRepository).save(snapshot);
            verify(snapshotCache).put(snapshot);
            verify(eventPublisher).publishEvent(any(SnapshotEvaluatedEvent.class));
            verify(alertManager).onSnapshotEvaluated(service, target, null, snapshot);
        }

        @Test
        @DisplayName("hands the previous risk level to alerting")
        void previousRisk() {
            BurnRateSnapshot previous = BurnRateSnapshot.builder()
                    .serviceId(1L).sloTargetId(10L).riskLevel(RiskLevel.DANGER)
                    .evaluatedAt(NOW.minusSeconds(60)).build();
            when(snapshotRepository.findRecentByTarget(10L, 1)).thenReturn(List.of(previous));

            BurnRateSnapshot snapshot = evaluationService.evaluateService(service, tick()).get(0);

            verify(alertManager).onSnapshotEvaluated(service, target, RiskLevel.DANGER, snapshot);
        }

        @Test
        @DisplayName("an abandoned tick writes nothing")
        void abandonedTick() {
            when(snapshotRepository.findRecentByTarget(10L, 1)).thenReturn(List.of());
            EvaluationTick tick = tick();
            tick.abandon();

            assertThatThrownBy(() -> evaluationService.evaluateService(service, tick))
                    .isInstanceOf(StaleEvaluationException.class);

            verify(ledgerRepository, never()).save(any());
            verify(snapshotRepository, never()).save(any());
            verify(snapshotCache, never()).put(any());
            verify(alertManager, never()).onSnapshotEvaluated(any(), any(), any(), any());
        }

        @Test
        @DisplayName("an abandon during the commit is refused and the follow-ups still run")
        void abandonDuringCommit() {
            when(snapshotRepository.findRecentByTarget(10L, 1)).thenReturn(List.of());
            EvaluationTick tick = tick();
            AtomicBoolean abandoned = new AtomicBoolean(true);
            when(ledgerRepository.save(any(ErrorBudgetLedgerEntry.class))).thenAnswer(invocation -> {
                abandoned.set(tick.abandon());
                return invocation.getArgument(0);
            });

            BurnRateSnapshot snapshot = evaluationService.evaluateService(service, tick).get(0);

            assertThat(abandoned).isFalse();
            assertThat(tick.isAbandoned()).isFalse();
            verify(snapshotRepository).save(snapshot);
            verify(snapshotCache).put(snapshot);
            verify(alertManager).onSnapshotEvaluated(service, target, null, snapshot);
            assertThat(tick.abandon()).isTrue();
        }

        @Test
        @DisplayName("a storage failure leaves the cache and alerting untouched")
        void storageFailure() {
            when(snapshotRepository.findRecentByTarget(10L, 1)).thenReturn(List.of());
            when(snapshotRepository.save(any(BurnRateSnapshot.class)))
                    .thenThrow(new IllegalStateException("connection reset"));

            assertThatThrownBy(() -> evaluationService.evaluateService(service, tick()))
                    .isInstanceOf(IllegalStateException.class);

            verify(snapshotCache, never()).put(any());
            verify(alertManager, never()).onSnapshotEvaluated(any(), any(), any(), any());
            assertThat(MDC.get("service")).isNull();
        }
    }

    @Test
    @DisplayName("samples that arrived late for older parts of the window are loaded and charged")
    void lateSamplesOutsideTheLoadedRange() {
        SloTarget tenDaysOld = SloTarget.builder()
                .targetId(10L).serviceId(1L).name("availability").targetValue(99.9).windowDays(30)
                .active(true).createdAt(NOW.minus(Duration.ofDays(10))).build();
        ErrorBudgetLedgerEntry prior = ErrorBudgetLedgerEntry.builder()
                .serviceId(1L).sloTargetId(10L)
                .windowStart(NOW.minus(Duration.ofDays(10)))
                .windowEnd(NOW.plus(Duration.ofDays(20)))
                .consumedErrorHours(0.1)
                .lastAccruedAt(NOW.minusSeconds(60))
                .lastSampleId(500L)
                .version(2L)
                .build();
        when(sloTargetRepository.findActiveByServiceId(1L)).thenReturn(List.of(tenDaysOld));
        when(ledgerRepository.find(1L, 10L)).thenReturn(Optional.of(prior));
        when(trafficSampleRepository.findBetween(1L, NOW.minus(Duration.ofHours(24)), NOW)).thenReturn(List.of());
        when(trafficSampleRepository.findArrivedAfter(1L, 500L, NOW.minus(Duration.ofDays(10)),
                NOW.minus(Duration.ofHours(24))))
                .thenReturn(List.of(sample(501L, NOW.minus(Duration.ofDays(3)), 0, 1000)));

        evaluationService.evaluateService(service, tick());

        ArgumentCaptor<ErrorBudgetLedgerEntry> ledger = ArgumentCaptor.forClass(ErrorBudgetLedgerEntry.class);
        verify(ledgerRepository).save(ledger.capture());
        assertThat(ledger.getValue().getConsumedErrorHours()).isCloseTo(0.1 + 5 / 60.0, within(1e-12));
        assertThat(ledger.getValue().getLastSampleId()).isEqualTo(501L);
        assertThat(ledger.getValue().getVersion()).isEqualTo(2L);
    }

    private static EvaluationTick tick() {
        return new EvaluationTick(1L, 1, NOW);
    }

    private static TrafficSample sample(Instant at, long success, long errors) {
        return TrafficSample.builder().serviceId(1L).timestamp(at).successCount(success).errorCount(errors).build();
    }

    private static TrafficSample sample(Long id, Instant at, long success, long errors) {
        return TrafficSample.builder().sampleId(id).serviceId(1L).timestamp(at)
                .successCount(success).errorCount(errors).build();
    }
}
