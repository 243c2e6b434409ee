package com.company.errorbudget.repository;

import com.company.errorbudget.domain.TrafficSample;
import com.company.errorbudget.engine.WindowRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class TrafficSampleRepository {

    private final JdbcTemplate jdbcTemplate;

    public int saveAll(List<TrafficSample> samples) {
        if (samples.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO traffic_samples (service_id, sample_time, success_count, error_count)
            VALUES (?, ?, ?, ?)
            """;

        int[][] counts = jdbcTemplate.batchUpdate(sql, samples, 500, (ps, sample) -> {
            ps.setLong(1, sample.getServiceId());
            ps.setTimestamp(2, Timestamp.from(sample.getTimestamp()));
            ps.setLong(3, sample.getSuccessCount());
            ps.setLong(4, sample.getErrorCount());
        });

        int inserted = 0;
        for (int[] batch : counts) {
            inserted += batch.length;
        }
        return inserted;
    }

    /**
     * Samples with {@code from <= sample_time <= to}, oldest first
     */
    public List<TrafficSample> findBetween(Long serviceId, Instant from, Instant to) {
        String sql = """
            SELECT sample_id, service_id, sample_time, success_count, error_count
            FROM traffic_samples
            WHERE service_id = ?
            AND sample_time >= ?
            AND sample_time <= ?
            ORDER BY sample_time ASC
            """;

        return jdbcTemplate.query(sql, new TrafficSampleRowMapper(),
                serviceId, Timestamp.from(from), Timestamp.from(to));
    }

    /**
     * Samples stored after {@code afterSampleId} with {@code from <= sample_time < toExclusive}
     */
    public List<TrafficSample> findArrivedAfter(Long serviceId, long afterSampleId, Instant from, Instant toExclusive) {
        String sql = """
            SELECT sample_id, service_id, sample_time, success_count, error_count
            FROM traffic_samples
            WHERE service_id = ?
            AND sample_id > ?
            AND sample_time >= ?
            AND sample_time < ?
            ORDER BY sample_time ASC
            """;

        return jdbcTemplate.query(sql, new TrafficSampleRowMapper(),
                serviceId, afterSampleId, Timestamp.from(from), Timestamp.from(toExclusive));
    }

    /**
     * Totals over {@code from <= sample_time <= to} without loading rows
     */
    public WindowRate sumBetween(Long serviceId, Instant from, Instant to) {
        String sql = """
            SELECT COALESCE(SUM(success_count), 0) AS successes,
                   COALESCE(SUM(error_count), 0) AS errors
            FROM traffic_samples
            WHERE service_id = ?
            AND sample_time >= ?
            AND sample_time <= ?
            """;

        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> {
            long successes = rs.getLong("successes");
            long errors = rs.getLong("errors");
            return WindowRate.of(successes + errors, errors);
        }, serviceId, Timestamp.from(from), Timestamp.from(to));
    }

    public List<TrafficSample> findRecent(Long serviceId, int limit) {
        String sql = """
            SELECT sample_id, service_id, sample_time, success_count, error_count
            FROM traffic_samples
            WHERE service_id = ?
            ORDER BY sample_time DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new TrafficSampleRowMapper(), serviceId, limit);
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM traffic_samples WHERE sample_time < ?", Timestamp.from(cutoff));
    }

    private static class TrafficSampleRowMapper implements RowMapper<TrafficSample> {
        @Override
        public TrafficSample mapRow(ResultSet rs, int rowNum) throws SQLException {
            return TrafficSample.builder()
                    .sampleId(rs.getLong("sample_id"))
                    .serviceId(rs.getLong("service_id"))
                    .timestamp(rs.getTimestamp("sample_time").toInstant())
                    .successCount(rs.getLong("success_count"))
                    .errorCount(rs.getLong("error_count"))
                    .build();
        }
    }
}
