package com.company.errorbudget.service;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.domain.enums.AlertCategory;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.AlertStatus;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.dto.response.AcknowledgeResponse;
import com.company.errorbudget.dto.response.AlertResponse;
import com.company.errorbudget.event.AlertRaisedEvent;
import com.company.errorbudget.exception.AlertNotFoundException;
import com.company.errorbudget.repository.AlertRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AlertManagerService")
class AlertManagerServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private AlertRepository alertRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final AtomicLong ids = new AtomicLong(100);

    private AlertManagerService alertManager;

    private final MonitoredService service = MonitoredService.builder()
            .serviceId(1L).name("checkout").tier(1).active(true).build();
    private final SloTarget target = SloTarget.builder()
            .targetId(10L).serviceId(1L).name("availability").targetValue(99.9).windowDays(30).active(true).build();

    @BeforeEach
    void setUp() {
        alertManager = new AlertManagerService(alertRepository, new AlertCooldownRegistry(60, 30, 15),
                eventPublisher, meterRegistry, Clock.fixed(T0, ZoneOffset.UTC));
    }

    private void savesAssignIds() {
        when(alertRepository.save(any(Alert.class))).thenAnswer(invocation -> {
            Alert alert = invocation.getArgument(0);
            alert.setAlertId(ids.incrementAndGet());
            return alert;
        });
    }

    @Nested
    @DisplayName("on risk transitions")
    class Transitions {

        @Test
        @DisplayName("raises an emergency alert when a service enters FREEZE")
        void freezeRaisesEmergency() {
            savesAssignIds();

            Optional<Alert> alert = alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE,
                    snapshot(RiskLevel.FREEZE, T0));

            assertThat(alert).isPresent();
            assertThat(alert.get().getSeverity()).isEqualTo(AlertSeverity.EMERGENCY);
            assertThat(alert.get().getCategory()).isEqualTo(AlertCategory.SLO_RISK);
            assertThat(alert.get().getTitle()).isEqualTo("[EMERGENCY] Deployment Freeze: checkout");
            assertThat(alert.get().getMessage()).contains("risk changed from SAFE to FREEZE");
            assertThat(alert.get().getDeliveryStatus()).isEqualTo(AlertStatus.PENDING);
            verify(eventPublisher).publishEvent(any(AlertRaisedEvent.class));
            assertThat(meterRegistry.counter("errorbudget.alerts.raised",
                    "category", "SLO_RISK", "severity", "EMERGENCY").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("two consecutive FREEZE evaluations raise one alert")
        void repeatedFreezeRaisesOnce() {
            savesAssignIds();

            alertManager.onSnapshotEvaluated(service, target, null, snapshot(RiskLevel.FREEZE, T0));
            Optional<Alert> second = alertManager.onSnapshotEvaluated(service, target, RiskLevel.FREEZE,
                    snapshot(RiskLevel.FREEZE, T0.plusSeconds(60)));

            assertThat(second).isEmpty();
            verify(alertRepository, times(1)).save(any(Alert.class));
        }

        @Test
        @DisplayName("does not alert on recovery to SAFE")
        void recoveryIsSilent() {
            Optional<Alert> alert = alertManager.onSnapshotEvaluated(service, target, RiskLevel.DANGER,
                    snapshot(RiskLevel.SAFE, T0));

            assertThat(alert).isEmpty();
            verify(alertRepository, never()).save(any());
        }

        @Test
        @DisplayName("suppresses a downgrade while the higher alert cools down")
        void downgradeInsideCooldown() {
            savesAssignIds();

            alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE, snapshot(RiskLevel.FREEZE, T0));
            Optional<Alert> downgrade = alertManager.onSnapshotEvaluated(service, target, RiskLevel.FREEZE,
                    snapshot(RiskLevel.DANGER, T0.plusSeconds(60)));

            assertThat(downgrade).isEmpty();
            assertThat(meterRegistry.counter("errorbudget.alerts.suppressed",
                    "category", "SLO_RISK", "severity", "CRITICAL").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("re-alerts once the cooldown has elapsed")
        void reAlertAfterCooldown() {
            savesAssignIds();

            alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE, snapshot(RiskLevel.FREEZE, T0));
            alertManager.onSnapshotEvaluated(service, target, RiskLevel.FREEZE, snapshot(RiskLevel.DANGER, T0.plusSeconds(60)));
            Optional<Alert> again = alertManager.onSnapshotEvaluated(service, target, RiskLevel.DANGER,
                    snapshot(RiskLevel.FREEZE, T0.plusSeconds(20 * 60)));

            assertThat(again).isPresent();
            verify(alertRepository, times(2)).save(any(Alert.class));
        }

        @Test
        @DisplayName("frees the cooldown slot when storing the alert fails")
        void saveFailureReleasesReservation() {
            when(alertRepository.save(any(Alert.class)))
                    .thenThrow(new IllegalStateException("db down"))
                    .thenAnswer(invocation -> {
                        Alert alert = invocation.getArgument(0);
                        alert.setAlertId(1L);
                        return alert;
                    });

            assertThatThrownBy(() -> alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE,
                    snapshot(RiskLevel.DANGER, T0)))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE,
                    snapshot(RiskLevel.DANGER, T0.plusSeconds(5)))).isPresent();
        }
    }

    @Test
    @DisplayName("operational alerts are kept apart from SLO alerts")
    void operationalAlert() {
        savesAssignIds();
        alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE, snapshot(RiskLevel.DANGER, T0));

        Optional<Alert> operational = alertManager.raiseOperationalAlert(service, 3, "timeout");

        assertThat(operational).isPresent();
        assertThat(operational.get().getCategory()).isEqualTo(AlertCategory.OPERATIONAL);
        assertThat(operational.get().getMessage()).contains("failed 3 consecutive times");
    }

    @Nested
    @DisplayName("acknowledgement")
    class Acknowledgement {

        @Test
        @DisplayName("acknowledging an alert lifts its cooldown")
        void acknowledgeLiftsCooldown() {
            savesAssignIds();
            Alert raised = alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE,
                    snapshot(RiskLevel.DANGER, T0)).orElseThrow();
            when(alertRepository.findById(raised.getAlertId())).thenReturn(Optional.of(raised));

            AlertResponse response = alertManager.acknowledge(raised.getAlertId(), "oncall");

            assertThat(response.getAlertId()).isEqualTo(raised.getAlertId());
            verify(alertRepository).acknowledge(eq(List.of(raised.getAlertId())), eq("oncall"), eq(T0));
            assertThat(alertManager.onSnapshotEvaluated(service, target, RiskLevel.SAFE,
                    snapshot(RiskLevel.DANGER, T0.plusSeconds(60)))).isPresent();
        }

        @Test
        @DisplayName("an already acknowledged alert is returned unchanged")
        void alreadyAcknowledged() {
            Alert alert = Alert.builder().alertId(5L).serviceName("checkout").acknowledged(true)
                    .acknowledgedBy("someone").build();
            when(alertRepository.findById(5L)).thenReturn(Optional.of(alert));

            AlertResponse response = alertManager.acknowledge(5L, "oncall");

            assertThat(response.getAcknowledgedBy()).isEqualTo("someone");
            verify(alertRepository, never()).acknowledge(anyCollection(), any(), any());
        }

        @Test
        @DisplayName("unknown alert ids are reported")
        void unknownAlert() {
            when(alertRepository.findById(9L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> alertManager.acknowledge(9L, "oncall"))
                    .isInstanceOf(AlertNotFoundException.class);
        }

        @Test
        @DisplayName("bulk acknowledgement de-duplicates ids")
        void bulk() {
            when(alertRepository.acknowledge(anyCollection(), eq("oncall"), eq(T0))).thenReturn(2);

            AcknowledgeResponse response = alertManager.acknowledgeBulk(List.of(1L, 2L, 2L), "oncall");

            assertThat(response.getRequested()).isEqualTo(2);
            assertThat(response.getAcknowledged()).isEqualTo(2);
        }
    }

    private static BurnRateSnapshot snapshot(RiskLevel risk, Instant at) {
        return BurnRateSnapshot.builder()
                .serviceId(1L)
                .serviceName("checkout")
                .sloTargetId(10L)
                .evaluatedAt(at)
                .compositeBurnRate(risk == RiskLevel.SAFE ? 0.3 : 2.5)
                .errorBudgetRemaining(55.0)
                .riskLevel(risk)
                .build();
    }
}
