package com.company.obscalc.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Ownership lookups over the observation database. Read only.
 */
@Repository
@RequiredArgsConstructor
public class ObservationDirectory {

    private final JdbcTemplate jdbcTemplate;

    public Optional<String> programOf(String observationId) {
        List<String> results = jdbcTemplate.queryForList(
                "SELECT program_id FROM observation WHERE observation_id = ?",
                String.class, observationId);
        return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
    }

    public Optional<String> callForProposalsOf(String programId) {
        List<String> results = jdbcTemplate.queryForList(
                "SELECT cfp_id FROM program WHERE program_id = ?",
                String.class, programId);
        return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
    }

    public List<String> observationsForProgram(String programId) {
        return jdbcTemplate.queryForList("""
            SELECT observation_id
            FROM observation
            WHERE program_id = ?
            ORDER BY observation_id
            """, String.class, programId);
    }

    public List<String> observationsForCallForProposals(String cfpId) {
        return jdbcTemplate.queryForList("""
            SELECT o.observation_id
            FROM observation o
            JOIN program p ON p.program_id = o.program_id
            WHERE p.cfp_id = ?
            ORDER BY o.observation_id
            """, String.class, cfpId);
    }

    /**
     * Observations whose asterism references the target.
     */
    public List<String> observationsForTarget(String targetId) {
        return jdbcTemplate.queryForList("""
            SELECT observation_id
            FROM asterism_target
            WHERE target_id = ?
            ORDER BY observation_id
            """, String.class, targetId);
    }
}
