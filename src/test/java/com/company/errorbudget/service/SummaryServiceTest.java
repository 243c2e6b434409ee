package com.company.errorbudget.service;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.Forecast;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.BurnRateTrend;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.dto.response.HeatmapResponse;
import com.company.errorbudget.dto.response.PlatformSummaryResponse;
import com.company.errorbudget.dto.response.ServiceSummaryResponse;
import com.company.errorbudget.engine.ReleaseGateEvaluator;
import com.company.errorbudget.repository.AlertRepository;
import com.company.errorbudget.repository.BurnRateSnapshotRepository;
import com.company.errorbudget.security.CallerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SummaryService")
class SummaryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private ServiceCatalogService serviceCatalog;
    @Mock
    private BurnRateQueryService burnRateQueryService;
    @Mock
    private BurnRateSnapshotRepository snapshotRepository;
    @Mock
    private ForecastService forecastService;
    @Mock
    private AlertRepository alertRepository;
    @Mock
    private CallerContext callerContext;

    private SummaryService summaryService;

    private final MonitoredService checkout = service(1L, "checkout");
    private final MonitoredService payments = service(2L, "payments");
    private final MonitoredService search = service(3L, "search");

    @BeforeEach
    void setUp() {
        summaryService = new SummaryService(serviceCatalog, burnRateQueryService, snapshotRepository,
                forecastService, new ReleaseGateEvaluator(), alertRepository, callerContext,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("health score")
    class HealthScore {

        @Test
        @DisplayName("is 100 for a service that has not been evaluated")
        void unevaluated() {
            assertThat(SummaryService.healthScore(null, null)).isEqualTo(100.0);
        }

        @Test
        @DisplayName("deducts for fast burn, a low budget and an increasing trend")
        void deductions() {
            BurnRateSnapshot worst = snapshot(1L, "checkout", RiskLevel.FREEZE, 3.5, 10.0, NOW);
            Forecast forecast = Forecast.builder().burnRateTrend(BurnRateTrend.INCREASING).build();

            assertThat(SummaryService.healthScore(worst, forecast)).isEqualTo(40.0);
        }

        @Test
        @DisplayName("deducts 50 once the budget is exhausted")
        void exhausted() {
            BurnRateSnapshot worst = snapshot(1L, "checkout", RiskLevel.FREEZE, 5.0, 0.0, NOW);

            assertThat(SummaryService.healthScore(worst, null)).isEqualTo(50.0);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"100, healthy", "90, healthy", "89.9, degraded", "70, degraded", "69.9, critical", "0, critical"})
        @DisplayName("maps to health levels")
        void levels(double score, String health) {
            assertThat(SummaryService.healthOf(score)).isEqualTo(health);
        }
    }

    @Test
    @DisplayName("overview rolls up risk, budgets, forecasts and alerts")
    void overview() {
        when(serviceCatalog.findActiveServices()).thenReturn(List.of(checkout, payments, search));
        when(snapshotRepository.findLatestForActiveServices()).thenReturn(List.of(
                snapshot(1L, "checkout", RiskLevel.DANGER, 1.8, 40.0, NOW),
                snapshot(1L, "checkout", RiskLevel.SAFE, 0.2, 90.0, NOW),
                snapshot(2L, "payments", RiskLevel.SAFE, 0.5, 80.0, NOW)));
        when(forecastService.forecast(eq(checkout), any())).thenReturn(Forecast.builder()
                .serviceName("checkout").timeToExhaustionHours(12.0).burnRateTrend(BurnRateTrend.INCREASING).build());
        when(forecastService.forecast(eq(payments), any())).thenReturn(Forecast.builder()
                .serviceName("payments").burnRateTrend(BurnRateTrend.STABLE).build());
        when(forecastService.forecast(eq(search), any())).thenReturn(Forecast.builder()
                .serviceName("search").burnRateTrend(BurnRateTrend.STABLE).build());
        when(alertRepository.countUnacknowledged()).thenReturn(3);
        when(alertRepository.countUnacknowledgedAtLeast(AlertSeverity.CRITICAL)).thenReturn(1);

        PlatformSummaryResponse summary = summaryService.overview();

        assertThat(summary.getTotalServices()).isEqualTo(3);
        assertThat(summary.getRiskDistribution())
                .containsEntry("SAFE", 2).containsEntry("OBSERVE", 0)
                .containsEntry("DANGER", 1).containsEntry("FREEZE", 0);
        assertThat(summary.getAverageBudgetRemaining()).isCloseTo(60.0, within(1e-9));
        assertThat(summary.getLowestBudgetRemaining()).isEqualTo(40.0);
        assertThat(summary.getLowestBudgetService()).isEqualTo("checkout");
        assertThat(summary.getNearestExhaustion().getServiceName()).isEqualTo("checkout");
        assertThat(summary.getActiveAlerts()).isEqualTo(3);
        assertThat(summary.getCriticalAlerts()).isEqualTo(1);
        // (75 + 100 + 100) / 3
        assertThat(summary.getOverallHealth()).isEqualTo("healthy");
    }

    @Test
    @DisplayName("overview of an empty platform is healthy with a full budget")
    void emptyOverview() {
        when(serviceCatalog.findActiveServices()).thenReturn(List.of());
        when(snapshotRepository.findLatestForActiveServices()).thenReturn(List.of());

        PlatformSummaryResponse summary = summaryService.overview();

        assertThat(summary.getTotalServices()).isZero();
        assertThat(summary.getAverageBudgetRemaining()).isEqualTo(100.0);
        assertThat(summary.getLowestBudgetRemaining()).isNull();
        assertThat(summary.getNearestExhaustion()).isNull();
        assertThat(summary.getOverallHealth()).isEqualTo("healthy");
    }

    @Nested
    @DisplayName("service summary")
    class ServiceSummary {

        @Test
        @DisplayName("narrates risk, forecast, gate state and open alerts")
        void narrative() {
            BurnRateSnapshot worst = snapshot(1L, "checkout", RiskLevel.DANGER, 1.8, 40.0, NOW);
            when(serviceCatalog.requireService("checkout")).thenReturn(checkout);
            when(burnRateQueryService.latestSnapshots(checkout)).thenReturn(List.of(worst));
            when(forecastService.forecast(checkout, worst)).thenReturn(Forecast.builder()
                    .serviceName("checkout").forecastMessage("Budget is draining.").build());
            when(callerContext.getCurrentCaller()).thenReturn("tester");
            when(alertRepository.findUnacknowledgedByService(1L, 20)).thenReturn(List.of(
                    Alert.builder().alertId(9L).serviceName("checkout").severity(AlertSeverity.CRITICAL).build()));

            ServiceSummaryResponse summary = summaryService.serviceSummary("checkout");

            assertThat(summary.getRiskLevel()).isEqualTo(RiskLevel.DANGER);
            assertThat(summary.getReleaseGate().isAllowed()).isFalse();
            assertThat(summary.getOpenAlerts()).hasSize(1);
            assertThat(summary.getNarrative()).isEqualTo(
                    "checkout is at risk level DANGER with a composite burn rate of 1.80 and 40.0% of its "
                            + "error budget remaining. Budget is draining. Releases are currently blocked. "
                            + "1 alert is awaiting acknowledgement.");
        }

        @Test
        @DisplayName("says so when the service has not been evaluated")
        void notEvaluated() {
            when(serviceCatalog.requireService("checkout")).thenReturn(checkout);
            when(burnRateQueryService.latestSnapshots(checkout)).thenReturn(List.of());
            when(forecastService.forecast(checkout, null)).thenReturn(Forecast.builder().serviceName("checkout").build());
            when(callerContext.getCurrentCaller()).thenReturn("tester");
            when(alertRepository.findUnacknowledgedByService(1L, 20)).thenReturn(List.of());

            ServiceSummaryResponse summary = summaryService.serviceSummary("checkout");

            assertThat(summary.getRiskLevel()).isNull();
            assertThat(summary.getReleaseGate().isAllowed()).isTrue();
            assertThat(summary.getNarrative()).isEqualTo("checkout has not been evaluated yet.");
        }
    }

    @Nested
    @DisplayName("heatmap")
    class Heatmap {

        @Test
        @DisplayName("keeps the highest risk per bucket and SAFE where there is no data")
        void buckets() {
            when(snapshotRepository.findSince(NOW.minus(Duration.ofHours(6)))).thenReturn(List.of(
                    snapshot(1L, "checkout", RiskLevel.OBSERVE, 1.1, 90.0, NOW.minus(Duration.ofMinutes(300))),
                    snapshot(1L, "checkout", RiskLevel.SAFE, 0.2, 90.0, NOW.minus(Duration.ofMinutes(330))),
                    snapshot(1L, "checkout", RiskLevel.FREEZE, 4.0, 70.0, NOW.minus(Duration.ofHours(1)))));
            when(serviceCatalog.findActiveServices()).thenReturn(List.of(payments, checkout));

            HeatmapResponse heatmap = summaryService.heatmap(6, 2);

            assertThat(heatmap.getBuckets()).containsExactly(
                    NOW.minus(Duration.ofHours(6)), NOW.minus(Duration.ofHours(4)), NOW.minus(Duration.ofHours(2)));
            assertThat(heatmap.getServices()).extracting(HeatmapResponse.Row::getServiceName)
                    .containsExactly("checkout", "payments");
            assertThat(heatmap.getServices().get(0).getRiskLevels())
                    .containsExactly(RiskLevel.OBSERVE, RiskLevel.SAFE, RiskLevel.FREEZE);
            assertThat(heatmap.getServices().get(1).getRiskLevels())
                    .containsExactly(RiskLevel.SAFE, RiskLevel.SAFE, RiskLevel.SAFE);
        }

        @Test
        @DisplayName("rounds a partial last interval up to a whole bucket")
        void partialBucket() {
            when(snapshotRepository.findSince(any(Instant.class))).thenReturn(List.of());
            when(serviceCatalog.findActiveServices()).thenReturn(List.of(checkout));

            HeatmapResponse heatmap = summaryService.heatmap(5, 2);

            assertThat(heatmap.getBuckets()).hasSize(3);
            assertThat(heatmap.getServices().get(0).getRiskLevels()).hasSize(3);
        }
    }

    private static MonitoredService service(Long id, String name) {
        return MonitoredService.builder().serviceId(id).name(name).tier(2).active(true).build();
    }

    private static BurnRateSnapshot snapshot(Long serviceId, String name, RiskLevel risk,
                                             double composite, double remaining, Instant at) {
        return BurnRateSnapshot.builder()
                .serviceId(serviceId)
                .serviceName(name)
                .sloTargetId(serviceId * 10)
                .evaluatedAt(at)
                .compositeBurnRate(composite)
                .errorBudgetRemaining(remaining)
                .errorBudgetConsumed(100.0 - remaining)
                .riskLevel(risk)
                .build();
    }
}
