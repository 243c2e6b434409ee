package com.company.errorbudget.repository;

import com.company.errorbudget.domain.ReleaseDecision;
import com.company.errorbudget.domain.enums.GateState;
import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.*;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Release gate audit trail. Rows are never updated.
 */
@Repository
@RequiredArgsConstructor
public class ReleaseDecisionRepository {

    private static final String SELECT = """
            SELECT decision_id, service_id, service_name, deployment_id, version, requested_by,
                   override_requested, override_reason, overridden, state, allowed, reason,
                   risk_level, composite_burn_rate, error_budget_remaining, time_to_exhaustion_hours,
                   snapshot_evaluated_at, recommendations, decided_at
            FROM release_decisions
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Returns a copy carrying the generated id
     */
    public ReleaseDecision save(ReleaseDecision decision) {
        String sql = """
            INSERT INTO release_decisions (
                service_id, service_name, deployment_id, version, requested_by,
                override_requested, override_reason, overridden, state, allowed, reason,
                risk_level, composite_burn_rate, error_budget_remaining, time_to_exhaustion_hours,
                snapshot_evaluated_at, recommendations, decided_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"decision_id"});
            ps.setLong(1, decision.getServiceId());
            ps.setString(2, decision.getServiceName());
            ps.setString(3, decision.getDeploymentId());
            ps.setString(4, decision.getVersion());
            ps.setString(5, decision.getRequestedBy());
            ps.setBoolean(6, decision.isOverrideRequested());
            ps.setString(7, decision.getOverrideReason());
            ps.setBoolean(8, decision.isOverridden());
            ps.setString(9, decision.getState().name());
            ps.setBoolean(10, decision.isAllowed());
            ps.setString(11, decision.getReason());
            ps.setString(12, decision.getRiskLevel().name());
            ps.setDouble(13, decision.getCompositeBurnRate());
            ps.setDouble(14, decision.getErrorBudgetRemaining());
            ps.setObject(15, decision.getTimeToExhaustionHours());
            ps.setTimestamp(16, decision.getSnapshotEvaluatedAt() != null
                    ? Timestamp.from(decision.getSnapshotEvaluatedAt()) : null);
            ps.setArray(17, connection.createArrayOf("text", decision.getRecommendations().toArray()));
            ps.setTimestamp(18, Timestamp.from(decision.getDecidedAt()));
            return ps;
        }, keyHolder);

        return decision.toBuilder().decisionId(keyHolder.getKey().longValue()).build();
    }

    public List<ReleaseDecision> findRecentByService(Long serviceId, int limit) {
        String sql = SELECT + """
            WHERE service_id = ?
            ORDER BY decided_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new ReleaseDecisionRowMapper(), serviceId, limit);
    }

    public List<ReleaseDecision> findSince(Instant since) {
        String sql = SELECT + """
            WHERE decided_at >= ?
            ORDER BY decided_at DESC
            """;

        return jdbcTemplate.query(sql, new ReleaseDecisionRowMapper(), Timestamp.from(since));
    }

    private static class ReleaseDecisionRowMapper implements RowMapper<ReleaseDecision> {
        @Override
        public ReleaseDecision mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp snapshotAt = rs.getTimestamp("snapshot_evaluated_at");
            Array recommendations = rs.getArray("recommendations");
            return ReleaseDecision.builder()
                    .decisionId(rs.getLong("decision_id"))
                    .serviceId(rs.getLong("service_id"))
                    .serviceName(rs.getString("service_name"))
                    .deploymentId(rs.getString("deployment_id"))
                    .version(rs.getString("version"))
                    .requestedBy(rs.getString("requested_by"))
                    .overrideRequested(rs.getBoolean("override_requested"))
                    .overrideReason(rs.getString("override_reason"))
                    .overridden(rs.getBoolean("overridden"))
                    .state(GateState.valueOf(rs.getString("state")))
                    .allowed(rs.getBoolean("allowed"))
                    .reason(rs.getString("reason"))
                    .riskLevel(RiskLevel.fromString(rs.getString("risk_level")))
                    .compositeBurnRate(rs.getDouble("composite_burn_rate"))
                    .errorBudgetRemaining(rs.getDouble("error_budget_remaining"))
                    .timeToExhaustionHours(rs.getObject("time_to_exhaustion_hours", Double.class))
                    .snapshotEvaluatedAt(snapshotAt != null ? snapshotAt.toInstant() : null)
                    .recommendations(recommendations != null
                            ? Arrays.asList((String[]) recommendations.getArray()) : List.of())
                    .decidedAt(rs.getTimestamp("decided_at").toInstant())
                    .build();
        }
    }
}
