package com.company.errorbudget.repository;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.domain.enums.AlertCategory;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.AlertStatus;
import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.*;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AlertRepository {

    private static final String SELECT = """
            SELECT alert_id, service_id, service_name, slo_target_id, category, severity, risk_level,
                   title, message, created_at, acknowledged, acknowledged_by, acknowledged_at,
                   delivery_status, delivered_at, retry_count, last_error
            FROM alerts
            """;

    private final JdbcTemplate jdbcTemplate;

    public Alert save(Alert alert) {
        if (alert.getCreatedAt() == null) {
            alert.setCreatedAt(Instant.now());
        }
        if (alert.getDeliveryStatus() == null) {
            alert.setDeliveryStatus(AlertStatus.PENDING);
        }

        String sql = """
            INSERT INTO alerts (
                service_id, service_name, slo_target_id, category, severity, risk_level,
                title, message, created_at, acknowledged, delivery_status, retry_count
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"alert_id"});
            ps.setLong(1, alert.getServiceId());
            ps.setString(2, alert.getServiceName());
            ps.setObject(3, alert.getSloTargetId());
            ps.setString(4, alert.getCategory().name());
            ps.setString(5, alert.getSeverity().name());
            ps.setString(6, alert.getRiskLevel() != null ? alert.getRiskLevel().name() : null);
            ps.setString(7, alert.getTitle());
            ps.setString(8, alert.getMessage());
            ps.setTimestamp(9, Timestamp.from(alert.getCreatedAt()));
            ps.setBoolean(10, alert.isAcknowledged());
            ps.setString(11, alert.getDeliveryStatus().name());
            ps.setInt(12, alert.getRetryCount() != null ? alert.getRetryCount() : 0);
            return ps;
        }, keyHolder);

        alert.setAlertId(keyHolder.getKey().longValue());
        return alert;
    }

    public Optional<Alert> findById(Long alertId) {
        List<Alert> results = jdbcTemplate.query(SELECT + " WHERE alert_id = ?", new AlertRowMapper(), alertId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Marks unacknowledged alerts as acknowledged; already acknowledged ones keep
     * their original acknowledger. Returns the number of rows changed.
     */
    public int acknowledge(Collection<Long> alertIds, String acknowledgedBy, Instant at) {
        if (alertIds.isEmpty()) {
            return 0;
        }

        String placeholders = String.join(", ", Collections.nCopies(alertIds.size(), "?"));
        String sql = """
            UPDATE alerts
            SET acknowledged = true, acknowledged_by = ?, acknowledged_at = ?
            WHERE acknowledged = false
            AND alert_id IN (%s)
            """.formatted(placeholders);

        List<Object> args = new ArrayList<>();
        args.add(acknowledgedBy);
        args.add(Timestamp.from(at));
        args.addAll(alertIds);
        return jdbcTemplate.update(sql, args.toArray());
    }

    /**
     * Alert feed since the given instant, newest first. Null filters are ignored.
     */
    public List<Alert> findFeed(Long serviceId, AlertSeverity severity, Boolean acknowledged,
                                Instant since, int limit) {
        StringBuilder sql = new StringBuilder(SELECT).append(" WHERE created_at >= ?");
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(since));

        if (serviceId != null) {
            sql.append(" AND service_id = ?");
            args.add(serviceId);
        }
        if (severity != null) {
            sql.append(" AND severity = ?");
            args.add(severity.name());
        }
        if (acknowledged != null) {
            sql.append(" AND acknowledged = ?");
            args.add(acknowledged);
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");
        args.add(limit);

        return jdbcTemplate.query(sql.toString(), new AlertRowMapper(), args.toArray());
    }

    public List<Alert> findUnacknowledgedSince(Instant since) {
        String sql = SELECT + """
            WHERE acknowledged = false
            AND created_at >= ?
            ORDER BY created_at ASC
            """;

        return jdbcTemplate.query(sql, new AlertRowMapper(), Timestamp.from(since));
    }

    public List<Alert> findUnacknowledgedByService(Long serviceId, int limit) {
        String sql = SELECT + """
            WHERE acknowledged = false
            AND service_id = ?
            ORDER BY created_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new AlertRowMapper(), serviceId, limit);
    }

    public int countUnacknowledged() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alerts WHERE acknowledged = false", Integer.class);
        return count != null ? count : 0;
    }

    public int countUnacknowledgedAtLeast(AlertSeverity severity) {
        List<String> severities = Arrays.stream(AlertSeverity.values())
                .filter(s -> s.isAtLeast(severity))
                .map(Enum::name)
                .collect(Collectors.toList());

        String placeholders = String.join(", ", Collections.nCopies(severities.size(), "?"));
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alerts WHERE acknowledged = false AND severity IN (" + placeholders + ")",
                Integer.class, severities.toArray());
        return count != null ? count : 0;
    }

    public Map<AlertSeverity, Long> countBySeveritySince(Instant since) {
        String sql = """
            SELECT severity, COUNT(*) AS total
            FROM alerts
            WHERE created_at >= ?
            GROUP BY severity
            """;

        Map<AlertSeverity, Long> counts = new EnumMap<>(AlertSeverity.class);
        jdbcTemplate.query(sql, (RowCallbackHandler) rs ->
                counts.put(AlertSeverity.fromString(rs.getString("severity")), rs.getLong("total")),
                Timestamp.from(since));
        return counts;
    }

    /**
     * Alerts whose notification has not been delivered yet
     */
    public List<Alert> findPendingDelivery(int maxRetries, int limit) {
        String sql = SELECT + """
            WHERE delivery_status IN ('PENDING', 'FAILED')
            AND retry_count < ?
            ORDER BY created_at ASC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new AlertRowMapper(), maxRetries, limit);
    }

    public void updateDelivery(Alert alert) {
        String sql = """
            UPDATE alerts
            SET delivery_status = ?, delivered_at = ?, retry_count = ?, last_error = ?
            WHERE alert_id = ?
            """;

        jdbcTemplate.update(sql,
                alert.getDeliveryStatus().name(),
                alert.getDeliveredAt() != null ? Timestamp.from(alert.getDeliveredAt()) : null,
                alert.getRetryCount() != null ? alert.getRetryCount() : 0,
                alert.getLastError(),
                alert.getAlertId()
        );
    }

    private static class AlertRowMapper implements RowMapper<Alert> {
        @Override
        public Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp acknowledgedAt = rs.getTimestamp("acknowledged_at");
            Timestamp deliveredAt = rs.getTimestamp("delivered_at");
            String riskLevel = rs.getString("risk_level");
            return Alert.builder()
                    .alertId(rs.getLong("alert_id"))
                    .serviceId(rs.getLong("service_id"))
                    .serviceName(rs.getString("service_name"))
                    .sloTargetId(rs.getObject("slo_target_id", Long.class))
                    .category(AlertCategory.fromString(rs.getString("category")))
                    .severity(AlertSeverity.fromString(rs.getString("severity")))
                    .riskLevel(riskLevel != null ? RiskLevel.fromString(riskLevel) : null)
                    .title(rs.getString("title"))
                    .message(rs.getString("message"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .acknowledged(rs.getBoolean("acknowledged"))
                    .acknowledgedBy(rs.getString("acknowledged_by"))
                    .acknowledgedAt(acknowledgedAt != null ? acknowledgedAt.toInstant() : null)
                    .deliveryStatus(AlertStatus.fromString(rs.getString("delivery_status")))
                    .deliveredAt(deliveredAt != null ? deliveredAt.toInstant() : null)
                    .retryCount(rs.getInt("retry_count"))
                    .lastError(rs.getString("last_error"))
                    .build();
        }
    }
}
