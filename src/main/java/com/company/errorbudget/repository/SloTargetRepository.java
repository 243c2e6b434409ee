package com.company.errorbudget.repository;

import com.company.errorbudget.domain.SloTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.*;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SloTargetRepository {

    private static final String COLUMNS = """
            target_id, service_id, name, target_value, window_days,
            burn_rate_threshold, critical_burn_rate, active, created_at, updated_at
            """;

    private final JdbcTemplate jdbcTemplate;

    public SloTarget save(SloTarget target) {
        Instant now = Instant.now();
        if (target.getCreatedAt() == null) {
            target.setCreatedAt(now);
        }
        target.setUpdatedAt(now);
        if (target.getActive() == null) {
            target.setActive(true);
        }

        String sql = """
            INSERT INTO slo_targets (
                service_id, name, target_value, window_days,
                burn_rate_threshold, critical_burn_rate, active, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"target_id"});
            ps.setLong(1, target.getServiceId());
            ps.setString(2, target.getName());
            ps.setDouble(3, target.getTargetValue());
            ps.setInt(4, target.getWindowDays());
            ps.setDouble(5, target.getBurnRateThreshold());
            ps.setDouble(6, target.getCriticalBurnRate());
            ps.setBoolean(7, target.getActive());
            ps.setTimestamp(8, Timestamp.from(target.getCreatedAt()));
            ps.setTimestamp(9, Timestamp.from(target.getUpdatedAt()));
            return ps;
        }, keyHolder);

        target.setTargetId(keyHolder.getKey().longValue());
        return target;
    }

    public void update(SloTarget target) {
        target.setUpdatedAt(Instant.now());

        String sql = """
            UPDATE slo_targets
            SET name = ?, target_value = ?, window_days = ?,
                burn_rate_threshold = ?, critical_burn_rate = ?, active = ?, updated_at = ?
            WHERE target_id = ?
            """;

        jdbcTemplate.update(sql,
                target.getName(),
                target.getTargetValue(),
                target.getWindowDays(),
                target.getBurnRateThreshold(),
                target.getCriticalBurnRate(),
                target.getActive(),
                Timestamp.from(target.getUpdatedAt()),
                target.getTargetId()
        );
    }

    public Optional<SloTarget> findById(Long targetId) {
        String sql = "SELECT " + COLUMNS + " FROM slo_targets WHERE target_id = ?";
        List<SloTarget> results = jdbcTemplate.query(sql, new SloTargetRowMapper(), targetId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<SloTarget> findByServiceId(Long serviceId, boolean activeOnly) {
        String sql = "SELECT " + COLUMNS + " FROM slo_targets WHERE service_id = ?"
                + (activeOnly ? " AND active = true" : "")
                + " ORDER BY target_id ASC";
        return jdbcTemplate.query(sql, new SloTargetRowMapper(), serviceId);
    }

    public List<SloTarget> findActiveByServiceId(Long serviceId) {
        return findByServiceId(serviceId, true);
    }

    private static class SloTargetRowMapper implements RowMapper<SloTarget> {
        @Override
        public SloTarget mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SloTarget.builder()
                    .targetId(rs.getLong("target_id"))
                    .serviceId(rs.getLong("service_id"))
                    .name(rs.getString("name"))
                    .targetValue(rs.getDouble("target_value"))
                    .windowDays(rs.getInt("window_days"))
                    .burnRateThreshold(rs.getDouble("burn_rate_threshold"))
                    .criticalBurnRate(rs.getDouble("critical_burn_rate"))
                    .active(rs.getBoolean("active"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
