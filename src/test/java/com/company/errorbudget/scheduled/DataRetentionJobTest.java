package com.company.errorbudget.scheduled;

import com.company.errorbudget.repository.BurnRateSnapshotRepository;
import com.company.errorbudget.repository.TrafficSampleRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DataRetentionJob")
class DataRetentionJobTest {

    private static final Instant NOW = Instant.parse("2024-03-01T02:30:00Z");

    @Mock
    private TrafficSampleRepository trafficSampleRepository;
    @Mock
    private BurnRateSnapshotRepository snapshotRepository;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private DataRetentionJob job() {
        return new DataRetentionJob(trafficSampleRepository, snapshotRepository, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC), 35, 90);
    }

    @Test
    @DisplayName("purges samples and snapshots past their retention")
    void purges() {
        when(trafficSampleRepository.deleteOlderThan(NOW.minus(Duration.ofDays(35)))).thenReturn(120);
        when(snapshotRepository.deleteOlderThan(NOW.minus(Duration.ofDays(90)))).thenReturn(7);

        job().purge();

        assertThat(meterRegistry.counter("errorbudget.retention.deleted", "table", "traffic_samples").count())
                .isEqualTo(120.0);
        assertThat(meterRegistry.counter("errorbudget.retention.deleted", "table", "burn_rate_snapshots").count())
                .isEqualTo(7.0);
    }

    @Test
    @DisplayName("counts a failed purge and keeps the scheduler alive")
    void failure() {
        when(trafficSampleRepository.deleteOlderThan(NOW.minus(Duration.ofDays(35))))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        job().purge();

        assertThat(meterRegistry.counter("errorbudget.retention.failures").count()).isEqualTo(1.0);
    }
}
