package com.company.obscalc.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Links telluric calibration observations to the science observation they serve.
 */
@Repository
@RequiredArgsConstructor
public class TelluricRequestRepository {

    private final JdbcTemplate jdbcTemplate;

    public void link(String calibrationObservationId, String scienceObservationId, Instant at) {
        try {
            jdbcTemplate.update("""
                INSERT INTO telluric_request (observation_id, science_observation_id, created_at)
                VALUES (?, ?, ?)
                """, calibrationObservationId, scienceObservationId, Timestamp.from(at));
        } catch (DuplicateKeyException e) {
            jdbcTemplate.update("""
                UPDATE telluric_request
                SET science_observation_id = ?
                WHERE observation_id = ?
                """, scienceObservationId, calibrationObservationId);
        }
    }

    public Optional<String> findScienceObservation(String calibrationObservationId) {
        List<String> results = jdbcTemplate.queryForList(
                "SELECT science_observation_id FROM telluric_request WHERE observation_id = ?",
                String.class, calibrationObservationId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<String> findCalibrationsFor(String scienceObservationId) {
        return jdbcTemplate.queryForList("""
            SELECT observation_id
            FROM telluric_request
            WHERE science_observation_id = ?
            ORDER BY observation_id
            """, String.class, scienceObservationId);
    }
}
