package com.company.errorbudget.service;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.ReleaseDecision;
import com.company.errorbudget.domain.enums.GateState;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.dto.request.OverrideRequest;
import com.company.errorbudget.dto.request.ReleaseCheckRequest;
import com.company.errorbudget.dto.response.ReleaseDecisionResponse;
import com.company.errorbudget.dto.response.ReleaseStatisticsResponse;
import com.company.errorbudget.dto.response.ReleaseStatusResponse;
import com.company.errorbudget.engine.ReleaseGateEvaluator;
import com.company.errorbudget.exception.InvalidReleaseRequestException;
import com.company.errorbudget.exception.ServiceNotFoundException;
import com.company.errorbudget.repository.ReleaseDecisionRepository;
import com.company.errorbudget.security.CallerContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReleaseGateService")
class ReleaseGateServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private ServiceCatalogService serviceCatalog;
    @Mock
    private BurnRateQueryService burnRateQueryService;
    @Mock
    private ForecastService forecastService;
    @Mock
    private ReleaseDecisionRepository decisionRepository;
    @Mock
    private CallerContext callerContext;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ReleaseGateService releaseGateService;

    private final MonitoredService checkout = MonitoredService.builder()
            .serviceId(1L).name("checkout").tier(1).active(true).build();

    @BeforeEach
    void setUp() {
        releaseGateService = new ReleaseGateService(serviceCatalog, burnRateQueryService, forecastService,
                new ReleaseGateEvaluator(), decisionRepository, callerContext, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void serviceAtRisk(RiskLevel risk) {
        BurnRateSnapshot snapshot = BurnRateSnapshot.builder()
                .serviceId(1L).serviceName("checkout").sloTargetId(10L)
                .evaluatedAt(NOW.minusSeconds(45)).compositeBurnRate(risk.blocksRelease() ? 2.5 : 0.4)
                .errorBudgetRemaining(70.0).riskLevel(risk).build();
        when(serviceCatalog.requireService("checkout")).thenReturn(checkout);
        when(burnRateQueryService.worstLatestSnapshot(checkout)).thenReturn(snapshot);
    }

    private void decisionsAreStored() {
        when(decisionRepository.save(any(ReleaseDecision.class)))
                .thenAnswer(invocation -> ((ReleaseDecision) invocation.getArgument(0)).toBuilder().decisionId(77L).build());
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("allows and records a release at SAFE")
        void allowed() {
            serviceAtRisk(RiskLevel.SAFE);
            decisionsAreStored();
            when(callerContext.resolve("ci")).thenReturn("ci");

            ReleaseDecisionResponse response = releaseGateService.check(request(false, null));

            assertThat(response.getDecisionId()).isEqualTo(77L);
            assertThat(response.isAllowed()).isTrue();
            assertThat(response.getState()).isEqualTo(GateState.ALLOWED);
            assertThat(response.getRequestedBy()).isEqualTo("ci");
            assertThat(response.getDecidedAt()).isEqualTo(NOW);
            assertThat(meterRegistry.counter("errorbudget.release.decisions",
                    "state", "ALLOWED", "overridden", "false").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("blocks a release at DANGER")
        void blocked() {
            serviceAtRisk(RiskLevel.DANGER);
            decisionsAreStored();
            when(callerContext.resolve("ci")).thenReturn("ci");

            ReleaseDecisionResponse response = releaseGateService.check(request(false, null));

            assertThat(response.isAllowed()).isFalse();
            assertThat(response.getRiskLevel()).isEqualTo(RiskLevel.DANGER);
            assertThat(response.getSnapshotEvaluatedAt()).isEqualTo(NOW.minusSeconds(45));
        }

        @Test
        @DisplayName("rejects an override without a reason before looking up the service")
        void overrideWithoutReason() {
            when(callerContext.resolve("ci")).thenReturn("ci");

            assertThatThrownBy(() -> releaseGateService.check(request(true, " ")))
                    .isInstanceOf(InvalidReleaseRequestException.class);

            verify(serviceCatalog, never()).requireService(anyString());
            verify(decisionRepository, never()).save(any());
        }

        @Test
        @DisplayName("unknown services are not recorded")
        void unknownService() {
            when(callerContext.resolve("ci")).thenReturn("ci");
            when(serviceCatalog.requireService("checkout")).thenThrow(new ServiceNotFoundException("checkout"));

            assertThatThrownBy(() -> releaseGateService.check(request(false, null)))
                    .isInstanceOf(ServiceNotFoundException.class);

            verify(decisionRepository, never()).save(any());
        }
    }

    @Test
    @DisplayName("an override turns a FREEZE block into an audited allow")
    void override() {
        serviceAtRisk(RiskLevel.FREEZE);
        decisionsAreStored();
        when(callerContext.resolve(null)).thenReturn("alice");

        ReleaseDecisionResponse response = releaseGateService.override("checkout", OverrideRequest.builder()
                .deploymentId("deploy-9").overrideReason("security patch").build());

        assertThat(response.isAllowed()).isTrue();
        assertThat(response.isOverridden()).isTrue();
        assertThat(response.getRiskLevel()).isEqualTo(RiskLevel.FREEZE);
        assertThat(response.getRequestedBy()).isEqualTo("alice");
        assertThat(meterRegistry.counter("errorbudget.release.decisions",
                "state", "ALLOWED", "overridden", "true").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("current status is a dry run that is not recorded")
    void currentStatus() {
        serviceAtRisk(RiskLevel.DANGER);
        when(callerContext.getCurrentCaller()).thenReturn("viewer");
        when(decisionRepository.findRecentByService(1L, 10)).thenReturn(List.of());

        ReleaseStatusResponse status = releaseGateService.currentStatus("checkout", 10);

        assertThat(status.getCurrent().isAllowed()).isFalse();
        assertThat(status.getRecentDecisions()).isEmpty();
        verify(decisionRepository, never()).save(any());
    }

    @Test
    @DisplayName("statistics count outcomes, overrides and risk levels")
    void statistics() {
        when(decisionRepository.findSince(NOW.minus(Duration.ofDays(7)))).thenReturn(List.of(
                decision(true, false, RiskLevel.SAFE),
                decision(false, false, RiskLevel.DANGER),
                decision(true, true, RiskLevel.FREEZE),
                decision(false, false, RiskLevel.FREEZE)));

        ReleaseStatisticsResponse statistics = releaseGateService.statistics(7);

        assertThat(statistics.getTotalChecks()).isEqualTo(4);
        assertThat(statistics.getAllowed()).isEqualTo(2);
        assertThat(statistics.getBlocked()).isEqualTo(2);
        assertThat(statistics.getOverrides()).isEqualTo(1);
        assertThat(statistics.getBlockRate()).isCloseTo(0.5, within(1e-9));
        assertThat(statistics.getRiskDistribution())
                .containsEntry("SAFE", 1).containsEntry("OBSERVE", 0)
                .containsEntry("DANGER", 1).containsEntry("FREEZE", 2);
    }

    private static ReleaseCheckRequest request(boolean override, String reason) {
        return ReleaseCheckRequest.builder()
                .serviceName("checkout")
                .deploymentId("deploy-1")
                .version("2.0.0")
                .requestedBy("ci")
                .override(override)
                .overrideReason(reason)
                .build();
    }

    private static ReleaseDecision decision(boolean allowed, boolean overridden, RiskLevel risk) {
        return ReleaseDecision.builder()
                .serviceId(1L)
                .serviceName("checkout")
                .allowed(allowed)
                .overridden(overridden)
                .state(allowed ? GateState.ALLOWED : GateState.BLOCKED)
                .riskLevel(risk)
                .decidedAt(NOW.minus(Duration.ofDays(1)))
                .build();
    }
}
