package com.company.obscalc.repository;

import com.company.obscalc.domain.ObservationSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the read-only inputs of a calculation from the observation database.
 */
@Repository
@RequiredArgsConstructor
public class ObservationSnapshotSource {

    private final JdbcTemplate jdbcTemplate;

    public Optional<ObservationSnapshot> load(String observationId) {
        List<ObservationSnapshot> found = jdbcTemplate.query("""
            SELECT o.observation_id, o.program_id, p.cfp_id, o.observing_mode, o.workflow_user_state
            FROM observation o
            JOIN program p ON p.program_id = o.program_id
            WHERE o.observation_id = ?
            """, new SnapshotRowMapper(), observationId);

        if (found.isEmpty()) {
            return Optional.empty();
        }

        ObservationSnapshot snapshot = found.get(0);
        snapshot.setTargets(jdbcTemplate.query("""
            SELECT t.target_id, t.target_name, t.existence
            FROM asterism_target a
            JOIN target t ON t.target_id = a.target_id
            WHERE a.observation_id = ?
            ORDER BY t.target_id
            """, new TargetRowMapper(), observationId));

        return Optional.of(snapshot);
    }

    private static class SnapshotRowMapper implements RowMapper<ObservationSnapshot> {
        @Override
        public ObservationSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ObservationSnapshot.builder()
                    .observationId(rs.getString("observation_id"))
                    .programId(rs.getString("program_id"))
                    .callForProposalsId(rs.getString("cfp_id"))
                    .observingMode(rs.getString("observing_mode"))
                    .workflowUserState(rs.getString("workflow_user_state"))
                    .build();
        }
    }

    private static class TargetRowMapper implements RowMapper<ObservationSnapshot.TargetRef> {
        @Override
        public ObservationSnapshot.TargetRef mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ObservationSnapshot.TargetRef(
                    rs.getString("target_id"),
                    rs.getString("target_name"),
                    rs.getString("existence"));
        }
    }
}
