package com.eainde.safepulse.truthlock;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stores lock metadata in the {@code incident_lock} table (see {@code db/truth_lock_schema.sql}).
 */
public class JdbcTruthLockRepository implements TruthLockRepository {

    private static final String SELECT_COLUMNS = """
            SELECT lock_id, incident_id, locked_at, unlock_deadline, auto_release_hours,
                   evidence_hash, is_released, released_at, outcome
            FROM incident_lock
            """;

    private static final RowMapper<LockRecord> ROW_MAPPER = JdbcTruthLockRepository::mapRow;

    private final JdbcTemplate jdbcTemplate;

    public JdbcTruthLockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(LockRecord record) {
        jdbcTemplate.update("""
                INSERT INTO incident_lock
                    (lock_id, incident_id, locked_at, unlock_deadline, auto_release_hours,
                     evidence_hash, is_released, released_at, outcome)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                record.lockId(),
                record.incidentId(),
                Timestamp.from(record.lockedAt()),
                Timestamp.from(record.unlockDeadline()),
                record.autoReleaseHours(),
                record.evidenceHash(),
                record.released(),
                record.releasedAt() == null ? null : Timestamp.from(record.releasedAt()),
                record.outcome() == null ? null : record.outcome().name());
    }

    @Override
    public void markReleased(String lockId, ReleaseOutcome outcome, Instant releasedAt) {
        // the is_released guard keeps the first terminal outcome
        jdbcTemplate.update("""
                UPDATE incident_lock
                SET is_released = TRUE,
                    released_at = ?,
                    outcome = ?
                WHERE lock_id = ? AND is_released = FALSE
                """, Timestamp.from(releasedAt), outcome.name(), lockId);
    }

    @Override
    public Optional<LockRecord> findById(String lockId) {
        List<LockRecord> rows = jdbcTemplate.query(SELECT_COLUMNS + "WHERE lock_id = ?", ROW_MAPPER, lockId);
        return rows.stream().findFirst();
    }

    @Override
    public List<LockRecord> findUnreleased() {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE is_released = FALSE ORDER BY locked_at", ROW_MAPPER);
    }

    static LockRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp releasedAt = rs.getTimestamp("released_at");
        String outcome = rs.getString("outcome");
        return new LockRecord(
                rs.getString("lock_id"),
                rs.getString("incident_id"),
                rs.getTimestamp("locked_at").toInstant(),
                rs.getTimestamp("unlock_deadline").toInstant(),
                rs.getInt("auto_release_hours"),
                rs.getString("evidence_hash"),
                rs.getBoolean("is_released"),
                releasedAt == null ? null : releasedAt.toInstant(),
                outcome == null ? null : ReleaseOutcome.valueOf(outcome));
    }
}
