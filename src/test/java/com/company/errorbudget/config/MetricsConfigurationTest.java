package com.company.errorbudget.config;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.event.SnapshotEvaluatedEvent;
import com.company.errorbudget.repository.AlertRepository;
import com.company.errorbudget.repository.MonitoredServiceRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MetricsConfiguration")
class MetricsConfigurationTest {

    @Mock
    private MonitoredServiceRepository serviceRepository;
    @Mock
    private AlertRepository alertRepository;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private MetricsConfiguration metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsConfiguration(serviceRepository, alertRepository);
        metrics.errorBudgetMetrics().bindTo(registry);
    }

    @Test
    @DisplayName("counts services by the risk of their worst target")
    void servicesByRisk() {
        metrics.onSnapshotEvaluated(event(1L, 10L, RiskLevel.SAFE));
        metrics.onSnapshotEvaluated(event(1L, 11L, RiskLevel.DANGER));
        metrics.onSnapshotEvaluated(event(2L, 20L, RiskLevel.DANGER));
        metrics.onSnapshotEvaluated(event(3L, 30L, RiskLevel.FREEZE));
        metrics.onSnapshotEvaluated(event(3L, 30L, RiskLevel.OBSERVE));

        assertThat(riskGauge(RiskLevel.SAFE)).isZero();
        assertThat(riskGauge(RiskLevel.OBSERVE)).isEqualTo(1.0);
        assertThat(riskGauge(RiskLevel.DANGER)).isEqualTo(2.0);
        assertThat(riskGauge(RiskLevel.FREEZE)).isZero();
    }

    @Test
    @DisplayName("reads alert and service counts from storage")
    void storageGauges() {
        when(serviceRepository.countActive()).thenReturn(8);
        when(alertRepository.countUnacknowledged()).thenReturn(4);
        when(alertRepository.countUnacknowledgedAtLeast(AlertSeverity.CRITICAL)).thenReturn(1);

        assertThat(registry.get("errorbudget.services.active").gauge().value()).isEqualTo(8.0);
        assertThat(registry.get("errorbudget.alerts.unacknowledged").gauge().value()).isEqualTo(4.0);
        assertThat(registry.get("errorbudget.alerts.unacknowledged.critical").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reports zero while storage is unavailable")
    void storageDown() {
        when(serviceRepository.countActive()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(registry.get("errorbudget.services.active").gauge().value()).isZero();
    }

    private double riskGauge(RiskLevel level) {
        return registry.get("errorbudget.services.by_risk").tag("risk", level.name()).gauge().value();
    }

    private static SnapshotEvaluatedEvent event(Long serviceId, Long targetId, RiskLevel risk) {
        BurnRateSnapshot snapshot = BurnRateSnapshot.builder()
                .serviceId(serviceId).sloTargetId(targetId).riskLevel(risk).build();
        return new SnapshotEvaluatedEvent(snapshot, null);
    }
}
