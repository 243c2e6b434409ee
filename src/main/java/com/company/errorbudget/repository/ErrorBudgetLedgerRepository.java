package com.company.errorbudget.repository;

import com.company.errorbudget.domain.ErrorBudgetLedgerEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * One row per (service, SLO) pair. Writes carry the version read so a lost
 * update surfaces as OptimisticLockingFailureException instead of overwriting.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ErrorBudgetLedgerRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<ErrorBudgetLedgerEntry> find(Long serviceId, Long sloTargetId) {
        String sql = """
            SELECT service_id, slo_target_id, window_start, window_end,
                   consumed_error_hours, last_accrued_at, last_sample_id, version, updated_at
            FROM error_budget_ledger
            WHERE service_id = ? AND slo_target_id = ?
            """;

        List<ErrorBudgetLedgerEntry> results =
                jdbcTemplate.query(sql, new LedgerRowMapper(), serviceId, sloTargetId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Inserts on first write, otherwise updates guarded by the entry's version.
     * Returns the entry with its new version.
     */
    public ErrorBudgetLedgerEntry save(ErrorBudgetLedgerEntry entry) {
        if (entry.getVersion() == null) {
            return insert(entry);
        }

        String sql = """
            UPDATE error_budget_ledger
            SET window_start = ?, window_end = ?, consumed_error_hours = ?,
                last_accrued_at = ?, last_sample_id = ?, version = version + 1, updated_at = ?
            WHERE service_id = ? AND slo_target_id = ? AND version = ?
            """;

        int updated = jdbcTemplate.update(sql,
                Timestamp.from(entry.getWindowStart()),
                Timestamp.from(entry.getWindowEnd()),
                entry.getConsumedErrorHours(),
                entry.getLastAccruedAt() != null ? Timestamp.from(entry.getLastAccruedAt()) : null,
                entry.getLastSampleId(),
                Timestamp.from(entry.getUpdatedAt()),
                entry.getServiceId(),
                entry.getSloTargetId(),
                entry.getVersion()
        );

        if (updated == 0) {
            throw new OptimisticLockingFailureException(String.format(
                    "Ledger for service %d target %d changed since version %d",
                    entry.getServiceId(), entry.getSloTargetId(), entry.getVersion()));
        }
        return entry.toBuilder().version(entry.getVersion() + 1).build();
    }

    private ErrorBudgetLedgerEntry insert(ErrorBudgetLedgerEntry entry) {
        String sql = """
            INSERT INTO error_budget_ledger (
                service_id, slo_target_id, window_start, window_end,
                consumed_error_hours, last_accrued_at, last_sample_id, version, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, 0, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                    entry.getServiceId(),
                    entry.getSloTargetId(),
                    Timestamp.from(entry.getWindowStart()),
                    Timestamp.from(entry.getWindowEnd()),
                    entry.getConsumedErrorHours(),
                    entry.getLastAccruedAt() != null ? Timestamp.from(entry.getLastAccruedAt()) : null,
                    entry.getLastSampleId(),
                    Timestamp.from(entry.getUpdatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new OptimisticLockingFailureException(String.format(
                    "Ledger for service %d target %d was created concurrently",
                    entry.getServiceId(), entry.getSloTargetId()), e);
        }
        return entry.toBuilder().version(0L).build();
    }

    private static class LedgerRowMapper implements RowMapper<ErrorBudgetLedgerEntry> {
        @Override
        public ErrorBudgetLedgerEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp lastAccrued = rs.getTimestamp("last_accrued_at");
            long sampleId = rs.getLong("last_sample_id");
            Long lastSampleId = rs.wasNull() ? null : sampleId;
            return ErrorBudgetLedgerEntry.builder()
                    .serviceId(rs.getLong("service_id"))
                    .sloTargetId(rs.getLong("slo_target_id"))
                    .windowStart(rs.getTimestamp("window_start").toInstant())
                    .windowEnd(rs.getTimestamp("window_end").toInstant())
                    .consumedErrorHours(rs.getDouble("consumed_error_hours"))
                    .lastAccruedAt(lastAccrued != null ? lastAccrued.toInstant() : null)
                    .lastSampleId(lastSampleId)
                    .version(rs.getLong("version"))
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
