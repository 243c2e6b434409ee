package com.company.errorbudget.repository;

import com.company.errorbudget.domain.MonitoredService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
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
@Slf4j
public class MonitoredServiceRepository {

    private static final String COLUMNS = """
            service_id, name, description, owner_team, tier, active, created_at, updated_at
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Throws DuplicateKeyException when the name is taken
     */
    public MonitoredService save(MonitoredService service) throws DuplicateKeyException {
        Instant now = Instant.now();
        if (service.getCreatedAt() == null) {
            service.setCreatedAt(now);
        }
        service.setUpdatedAt(now);
        if (service.getActive() == null) {
            service.setActive(true);
        }

        String sql = """
            INSERT INTO services (name, description, owner_team, tier, active, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"service_id"});
            ps.setString(1, service.getName());
            ps.setString(2, service.getDescription());
            ps.setString(3, service.getOwnerTeam());
            ps.setInt(4, service.getTier() != null ? service.getTier() : 2);
            ps.setBoolean(5, service.getActive());
            ps.setTimestamp(6, Timestamp.from(service.getCreatedAt()));
            ps.setTimestamp(7, Timestamp.from(service.getUpdatedAt()));
            return ps;
        }, keyHolder);

        service.setServiceId(keyHolder.getKey().longValue());
        return service;
    }

    public void update(MonitoredService service) {
        service.setUpdatedAt(Instant.now());

        String sql = """
            UPDATE services
            SET description = ?, owner_team = ?, tier = ?, active = ?, updated_at = ?
            WHERE service_id = ?
            """;

        jdbcTemplate.update(sql,
                service.getDescription(),
                service.getOwnerTeam(),
                service.getTier(),
                service.getActive(),
                Timestamp.from(service.getUpdatedAt()),
                service.getServiceId()
        );
    }

    public Optional<MonitoredService> findByName(String name) {
        String sql = "SELECT " + COLUMNS + " FROM services WHERE name = ?";
        List<MonitoredService> results = jdbcTemplate.query(sql, new MonitoredServiceRowMapper(), name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<MonitoredService> findById(Long serviceId) {
        String sql = "SELECT " + COLUMNS + " FROM services WHERE service_id = ?";
        List<MonitoredService> results = jdbcTemplate.query(sql, new MonitoredServiceRowMapper(), serviceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<MonitoredService> findAll(boolean activeOnly) {
        String sql = "SELECT " + COLUMNS + " FROM services"
                + (activeOnly ? " WHERE active = true" : "")
                + " ORDER BY tier ASC, name ASC";
        return jdbcTemplate.query(sql, new MonitoredServiceRowMapper());
    }

    public List<MonitoredService> findActive() {
        return findAll(true);
    }

    public int countActive() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM services WHERE active = true", Integer.class);
        return count != null ? count : 0;
    }

    private static class MonitoredServiceRowMapper implements RowMapper<MonitoredService> {
        @Override
        public MonitoredService mapRow(ResultSet rs, int rowNum) throws SQLException {
            return MonitoredService.builder()
                    .serviceId(rs.getLong("service_id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .ownerTeam(rs.getString("owner_team"))
                    .tier(rs.getInt("tier"))
                    .active(rs.getBoolean("active"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
