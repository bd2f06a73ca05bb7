package com.company.obscalc.repository;

import com.company.obscalc.domain.OwnerRef;
import com.company.obscalc.domain.OwnerSweep;
import com.company.obscalc.domain.enums.OwnerKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pending owner-wide invalidations. One row per owner; repeated enqueues
 * collapse to the latest change time.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class OwnerSweepRepository {

    private final JdbcTemplate jdbcTemplate;

    public void enqueue(OwnerRef owner, Instant changeTime) {
        try {
            jdbcTemplate.update("""
                INSERT INTO owner_sweep (owner_kind, owner_id, change_time)
                VALUES (?, ?, ?)
                """, owner.getKind().name(), owner.getId(), Timestamp.from(changeTime));
            log.debug("Queued sweep for {} {} at {}", owner.getKind(), owner.getId(), changeTime);
        } catch (DuplicateKeyException e) {
            int updated = jdbcTemplate.update("""
                UPDATE owner_sweep
                SET change_time = ?
                WHERE owner_kind = ?
                  AND owner_id = ?
                  AND change_time < ?
                """, Timestamp.from(changeTime), owner.getKind().name(), owner.getId(),
                    Timestamp.from(changeTime));
            log.debug("Sweep for {} {} already queued, advanced: {}",
                    owner.getKind(), owner.getId(), updated > 0);
        }
    }

    /**
     * Oldest sweeps first.
     */
    public List<OwnerSweep> findBatch(int limit) {
        return jdbcTemplate.query("""
            SELECT owner_kind, owner_id, change_time
            FROM owner_sweep
            ORDER BY change_time, owner_kind, owner_id
            LIMIT ?
            """, new OwnerSweepRowMapper(), limit);
    }

    /**
     * Remove a processed sweep unless a newer change was queued meanwhile.
     */
    public boolean deleteIfUnchanged(OwnerSweep sweep) {
        int rows = jdbcTemplate.update("""
            DELETE FROM owner_sweep
            WHERE owner_kind = ?
              AND owner_id = ?
              AND change_time = ?
            """, sweep.getOwner().getKind().name(), sweep.getOwner().getId(),
                Timestamp.from(sweep.getChangeTime()));
        return rows > 0;
    }

    /**
     * Latest change time still queued for the program or its call for
     * proposals, if any.
     */
    public Optional<Instant> latestPending(String programId, String cfpId) {
        Timestamp latest = jdbcTemplate.queryForObject("""
            SELECT MAX(change_time)
            FROM owner_sweep
            WHERE (owner_kind = 'PROGRAM' AND owner_id = ?)
               OR (owner_kind = 'CALL_FOR_PROPOSALS' AND owner_id = ?)
            """, Timestamp.class, programId, cfpId);
        return Optional.ofNullable(latest).map(Timestamp::toInstant);
    }

    public int countPending() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM owner_sweep", Integer.class);
        return count != null ? count : 0;
    }

    private static class OwnerSweepRowMapper implements RowMapper<OwnerSweep> {
        @Override
        public OwnerSweep mapRow(ResultSet rs, int rowNum) throws SQLException {
            return OwnerSweep.builder()
                    .owner(new OwnerRef(OwnerKind.valueOf(rs.getString("owner_kind")), rs.getString("owner_id")))
                    .changeTime(rs.getTimestamp("change_time").toInstant())
                    .build();
        }
    }
}
