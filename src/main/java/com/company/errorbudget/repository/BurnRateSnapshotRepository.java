package com.company.errorbudget.repository;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.*;
import java.time.Instant;
import java.util.List;

/**
 * Append-only evaluation history.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class BurnRateSnapshotRepository {

    private static final String SELECT = """
            SELECT b.snapshot_id, b.service_id, s.name AS service_name, b.slo_target_id, b.evaluated_at,
                   b.error_rate_5m, b.error_rate_1h, b.error_rate_24h,
                   b.burn_rate_5m, b.burn_rate_1h, b.burn_rate_24h, b.composite_burn_rate,
                   b.error_budget_consumed, b.error_budget_remaining, b.risk_level
            FROM burn_rate_snapshots b
            JOIN services s ON s.service_id = b.service_id
            """;

    private final JdbcTemplate jdbcTemplate;

    public BurnRateSnapshot save(BurnRateSnapshot snapshot) {
        String sql = """
            INSERT INTO burn_rate_snapshots (
                service_id, slo_target_id, evaluated_at,
                error_rate_5m, error_rate_1h, error_rate_24h,
                burn_rate_5m, burn_rate_1h, burn_rate_24h, composite_burn_rate,
                error_budget_consumed, error_budget_remaining, risk_level
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"snapshot_id"});
            ps.setLong(1, snapshot.getServiceId());
            ps.setLong(2, snapshot.getSloTargetId());
            ps.setTimestamp(3, Timestamp.from(snapshot.getEvaluatedAt()));
            ps.setDouble(4, snapshot.getErrorRate5m());
            ps.setDouble(5, snapshot.getErrorRate1h());
            ps.setDouble(6, snapshot.getErrorRate24h());
            ps.setDouble(7, snapshot.getBurnRate5m());
            ps.setDouble(8, snapshot.getBurnRate1h());
            ps.setDouble(9, snapshot.getBurnRate24h());
            ps.setDouble(10, snapshot.getCompositeBurnRate());
            ps.setDouble(11, snapshot.getErrorBudgetConsumed());
            ps.setDouble(12, snapshot.getErrorBudgetRemaining());
            ps.setString(13, snapshot.getRiskLevel().name());
            return ps;
        }, keyHolder);

        snapshot.setSnapshotId(keyHolder.getKey().longValue());
        return snapshot;
    }

    /**
     * Latest snapshot of every active target of one service
     */
    public List<BurnRateSnapshot> findLatestByService(Long serviceId) {
        String sql = """
            SELECT DISTINCT ON (b.slo_target_id)
                   b.snapshot_id, b.service_id, s.name AS service_name, b.slo_target_id, b.evaluated_at,
                   b.error_rate_5m, b.error_rate_1h, b.error_rate_24h,
                   b.burn_rate_5m, b.burn_rate_1h, b.burn_rate_24h, b.composite_burn_rate,
                   b.error_budget_consumed, b.error_budget_remaining, b.risk_level
            FROM burn_rate_snapshots b
            JOIN services s ON s.service_id = b.service_id
            JOIN slo_targets t ON t.target_id = b.slo_target_id AND t.active = true
            WHERE b.service_id = ?
            ORDER BY b.slo_target_id, b.evaluated_at DESC
            """;

        return jdbcTemplate.query(sql, new BurnRateSnapshotRowMapper(), serviceId);
    }

    /**
     * Latest snapshot of every active target of every active service
     */
    public List<BurnRateSnapshot> findLatestForActiveServices() {
        String sql = """
            SELECT DISTINCT ON (b.slo_target_id)
                   b.snapshot_id, b.service_id, s.name AS service_name, b.slo_target_id, b.evaluated_at,
                   b.error_rate_5m, b.error_rate_1h, b.error_rate_24h,
                   b.burn_rate_5m, b.burn_rate_1h, b.burn_rate_24h, b.composite_burn_rate,
                   b.error_budget_consumed, b.error_budget_remaining, b.risk_level
            FROM burn_rate_snapshots b
            JOIN services s ON s.service_id = b.service_id AND s.active = true
            JOIN slo_targets t ON t.target_id = b.slo_target_id AND t.active = true
            ORDER BY b.slo_target_id, b.evaluated_at DESC
            """;

        return jdbcTemplate.query(sql, new BurnRateSnapshotRowMapper());
    }

    /**
     * Most recent snapshots of one target, newest first
     */
    public List<BurnRateSnapshot> findRecentByTarget(Long sloTargetId, int limit) {
        String sql = SELECT + """
            WHERE b.slo_target_id = ?
            ORDER BY b.evaluated_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new BurnRateSnapshotRowMapper(), sloTargetId, limit);
    }

    /**
     * Snapshots of one service since the given instant, oldest first
     */
    public List<BurnRateSnapshot> findByServiceSince(Long serviceId, Instant since) {
        String sql = SELECT + """
            WHERE b.service_id = ?
            AND b.evaluated_at >= ?
            ORDER BY b.evaluated_at ASC
            """;

        return jdbcTemplate.query(sql, new BurnRateSnapshotRowMapper(), serviceId, Timestamp.from(since));
    }

    /**
     * Snapshots of all active services since the given instant, oldest first
     */
    public List<BurnRateSnapshot> findSince(Instant since) {
        String sql = SELECT + """
            WHERE s.active = true
            AND b.evaluated_at >= ?
            ORDER BY b.evaluated_at ASC
            """;

        return jdbcTemplate.query(sql, new BurnRateSnapshotRowMapper(), Timestamp.from(since));
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM burn_rate_snapshots WHERE evaluated_at < ?", Timestamp.from(cutoff));
    }

    private static class BurnRateSnapshotRowMapper implements RowMapper<BurnRateSnapshot> {
        @Override
        public BurnRateSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
            return BurnRateSnapshot.builder()
                    .snapshotId(rs.getLong("snapshot_id"))
                    .serviceId(rs.getLong("service_id"))
                    .serviceName(rs.getString("service_name"))
                    .sloTargetId(rs.getLong("slo_target_id"))
                    .evaluatedAt(rs.getTimestamp("evaluated_at").toInstant())
                    .errorRate5m(rs.getDouble("error_rate_5m"))
                    .errorRate1h(rs.getDouble("error_rate_1h"))
                    .errorRate24h(rs.getDouble("error_rate_24h"))
                    .burnRate5m(rs.getDouble("burn_rate_5m"))
                    .burnRate1h(rs.getDouble("burn_rate_1h"))
                    .burnRate24h(rs.getDouble("burn_rate_24h"))
                    .compositeBurnRate(rs.getDouble("composite_burn_rate"))
                    .errorBudgetConsumed(rs.getDouble("error_budget_consumed"))
                    .errorBudgetRemaining(rs.getDouble("error_budget_remaining"))
                    .riskLevel(RiskLevel.fromString(rs.getString("risk_level")))
                    .build();
        }
    }
}
