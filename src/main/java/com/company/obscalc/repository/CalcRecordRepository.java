package com.company.obscalc.repository;

import com.company.obscalc.domain.CalcRecord;
import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable calculation records for one {@link CalcKind}. Every write is a
 * single-row statement; updates are guarded by {@code row_version}.
 * <p>
 * Not a component: one instance per kind is declared in {@code CalcCacheConfig}.
 */
@Slf4j
public class CalcRecordRepository {

    private static final RowMapper<CalcRecord> ROW_MAPPER = new CalcRecordRowMapper();

    private final JdbcTemplate jdbcTemplate;
    private final CalcKind kind;

    private final String selectBase;
    private final String insertSql;
    private final String updateSql;

    public CalcRecordRepository(JdbcTemplate jdbcTemplate, CalcKind kind) {
        this.jdbcTemplate = jdbcTemplate;
        this.kind = kind;

        String table = kind.getTableName();
        this.selectBase = String.format("""
            SELECT observation_id, program_id, calc_state, last_invalidation, last_update,
                   retry_at, failure_count, invalidation_seq, claim_seq, claimed_at,
                   result, error_message, row_version
            FROM %s
            """, table);
        this.insertSql = String.format("""
            INSERT INTO %s (
                observation_id, program_id, calc_state, last_invalidation, last_update,
                retry_at, failure_count, invalidation_seq, claim_seq, claimed_at,
                result, error_message, row_version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, table);
        this.updateSql = String.format("""
            UPDATE %s
            SET calc_state = ?,
                last_invalidation = ?,
                last_update = ?,
                retry_at = ?,
                failure_count = ?,
                invalidation_seq = ?,
                claim_seq = ?,
                claimed_at = ?,
                result = ?,
                error_message = ?,
                row_version = ?
            WHERE observation_id = ?
              AND row_version = ?
            """, table);
    }

    public CalcKind getKind() {
        return kind;
    }

    public Optional<CalcRecord> find(String observationId) {
        List<CalcRecord> results = jdbcTemplate.query(
                selectBase + " WHERE observation_id = ?", ROW_MAPPER, observationId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<CalcRecord> findByProgram(String programId) {
        return jdbcTemplate.query(
                selectBase + " WHERE program_id = ? ORDER BY observation_id", ROW_MAPPER, programId);
    }

    /**
     * Insert a new record.
     *
     * @throws org.springframework.dao.DuplicateKeyException when a record for the
     *         observation already exists
     */
    public void insert(CalcRecord record) {
        jdbcTemplate.update(insertSql, new Object[]{
                record.getObservationId(),
                record.getProgramId(),
                record.getState().name(),
                toTimestamp(record.getLastInvalidation()),
                toTimestamp(record.getLastUpdate()),
                toTimestamp(record.getRetryAt()),
                record.getFailureCount(),
                record.getInvalidationSeq(),
                record.getClaimSeq(),
                toTimestamp(record.getClaimedAt()),
                record.getResult(),
                record.getErrorMessage(),
                record.getRowVersion()
        }, new int[]{
                Types.VARCHAR, Types.VARCHAR, Types.VARCHAR,
                Types.TIMESTAMP, Types.TIMESTAMP, Types.TIMESTAMP,
                Types.INTEGER, Types.BIGINT, Types.BIGINT, Types.TIMESTAMP,
                Types.VARCHAR, Types.VARCHAR, Types.BIGINT
        });
        log.debug("Inserted {} record for observation {} in state {}",
                kind, record.getObservationId(), record.getState());
    }

    /**
     * Replace the stored record with {@code updated} if nobody wrote it since
     * {@code expectedVersion} was read. On success the updated record carries
     * the new row version.
     *
     * @return false when the row changed concurrently or no longer exists
     */
    public boolean compareAndSet(long expectedVersion, CalcRecord updated) {
        long nextVersion = expectedVersion + 1;
        int rows;
        try {
            rows = jdbcTemplate.update(updateSql, new Object[]{
                    updated.getState().name(),
                    toTimestamp(updated.getLastInvalidation()),
                    toTimestamp(updated.getLastUpdate()),
                    toTimestamp(updated.getRetryAt()),
                    updated.getFailureCount(),
                    updated.getInvalidationSeq(),
                    updated.getClaimSeq(),
                    toTimestamp(updated.getClaimedAt()),
                    updated.getResult(),
                    updated.getErrorMessage(),
                    nextVersion,
                    updated.getObservationId(),
                    expectedVersion
            }, new int[]{
                    Types.VARCHAR, Types.TIMESTAMP, Types.TIMESTAMP, Types.TIMESTAMP,
                    Types.INTEGER, Types.BIGINT, Types.BIGINT, Types.TIMESTAMP,
                    Types.VARCHAR, Types.VARCHAR, Types.BIGINT,
                    Types.VARCHAR, Types.BIGINT
            });
        } catch (ConcurrencyFailureException e) {
            log.debug("Concurrent write on {} record {}: {}", kind, updated.getObservationId(), e.getMessage());
            return false;
        }

        if (rows == 1) {
            updated.setRowVersion(nextVersion);
            return true;
        }
        return false;
    }

    /**
     * Claimable records, oldest invalidation first.
     */
    public List<CalcRecord> findClaimable(Instant now, int limit) {
        return jdbcTemplate.query(selectBase + """
            WHERE calc_state = 'PENDING'
               OR (calc_state = 'RETRY' AND retry_at <= ?)
            ORDER BY last_invalidation, observation_id
            LIMIT ?
            """, ROW_MAPPER, Timestamp.from(now), limit);
    }

    /**
     * Records whose claim was taken before {@code claimedBefore} and never
     * settled.
     */
    public List<CalcRecord> findExpiredClaims(Instant claimedBefore, int limit) {
        return jdbcTemplate.query(selectBase + """
            WHERE calc_state = 'CALCULATING'
              AND claimed_at < ?
            ORDER BY claimed_at
            LIMIT ?
            """, ROW_MAPPER, Timestamp.from(claimedBefore), limit);
    }

    public List<CalcRecord> findCalculating() {
        return jdbcTemplate.query(
                selectBase + " WHERE calc_state = 'CALCULATING'", ROW_MAPPER);
    }

    public Map<CalcState, Long> countByState() {
        Map<CalcState, Long> counts = new EnumMap<>(CalcState.class);
        for (CalcState state : CalcState.values()) {
            counts.put(state, 0L);
        }

        jdbcTemplate.query(String.format(
                "SELECT calc_state, COUNT(*) AS cnt FROM %s GROUP BY calc_state", kind.getTableName()),
                rs -> {
                    counts.put(CalcState.fromString(rs.getString("calc_state")), rs.getLong("cnt"));
                });

        return counts;
    }

    public boolean delete(String observationId) {
        int rows = jdbcTemplate.update(String.format(
                "DELETE FROM %s WHERE observation_id = ?", kind.getTableName()), observationId);
        return rows > 0;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class CalcRecordRowMapper implements RowMapper<CalcRecord> {
        @Override
        public CalcRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CalcRecord.builder()
                    .observationId(rs.getString("observation_id"))
                    .programId(rs.getString("program_id"))
                    .state(CalcState.fromString(rs.getString("calc_state")))
                    .lastInvalidation(getInstant(rs, "last_invalidation"))
                    .lastUpdate(getInstant(rs, "last_update"))
                    .retryAt(getInstant(rs, "retry_at"))
                    .failureCount(rs.getInt("failure_count"))
                    .invalidationSeq(rs.getLong("invalidation_seq"))
                    .claimSeq(rs.getLong("claim_seq"))
                    .claimedAt(getInstant(rs, "claimed_at"))
                    .result(rs.getString("result"))
                    .errorMessage(rs.getString("error_message"))
                    .rowVersion(rs.getLong("row_version"))
                    .build();
        }

        private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
