package com.company.obscalc.integration;

import com.company.obscalc.client.ObservationCalculator;
import com.company.obscalc.domain.ClaimedCalc;
import com.company.obscalc.domain.result.ObservationCalcResult;
import com.company.obscalc.domain.result.ObservationWorkflow;
import com.company.obscalc.service.CalcCacheService;
import com.company.obscalc.service.ObscalcWorker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Upstream change -> pending record -> worker computes -> readers see the
 * current result, over the HTTP surface and the in-process worker.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ObscalcHappyPathIntegrationTest {

    @Autowired MockMvc mockMvc;
    @Autowired JdbcTemplate jdbcTemplate;
    @Autowired ObjectMapper objectMapper;
    @Autowired ObscalcWorker worker;
    @Autowired @Qualifier("obscalcService") CalcCacheService obscalcService;

    @MockBean ObservationCalculator calculator;

    private String programId;
    private String observationId;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        programId = "p-" + suffix;
        observationId = "o-" + suffix;
        jdbcTemplate.update("INSERT INTO program (program_id, cfp_id, program_name) VALUES (?, ?, ?)",
                programId, "cfp-" + suffix, "Integration");
        jdbcTemplate.update("INSERT INTO observation (observation_id, program_id, observing_mode) VALUES (?, ?, ?)",
                observationId, programId, "GMOS_SOUTH_LONG_SLIT");
    }

    private void invalidate() throws Exception {
        mockMvc.perform(post("/api/v1/invalidations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"observationId\": \"" + observationId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("CREATED"))
                .andExpect(jsonPath("$.newState").value("PENDING"));
    }

    private static String awaitContent(MvcResult result, String expected) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        String content = result.getResponse().getContentAsString();
        while (!content.contains(expected) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            content = result.getResponse().getContentAsString();
        }
        return content;
    }

    @Test
    @DisplayName("Happy path: invalidation -> in-process worker -> ready result")
    void happyPathThroughWorker() throws Exception {
        when(calculator.calculate(any())).thenReturn(
                ObservationCalcResult.builder().workflow(ObservationWorkflow.UNDEFINED).build());

        invalidate();
        mockMvc.perform(get("/api/v1/observations/{id}/calc", observationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PENDING"))
                .andExpect(jsonPath("$.stale").value(true));

        ClaimedCalc claim = obscalcService.claim(observationId).orElseThrow();
        worker.process(claim);

        mockMvc.perform(get("/api/v1/observations/{id}/calc", observationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("READY"))
                .andExpect(jsonPath("$.stale").value(false))
                .andExpect(jsonPath("$.result.workflow.state").value("UNDEFINED"));

        mockMvc.perform(get("/api/v1/programs/{id}/calc", programId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].observationId").value(observationId));
    }

    @Test
    @DisplayName("External worker claims and completes over HTTP")
    void externalWorkerProtocol() throws Exception {
        invalidate();

        MvcResult claimed = mockMvc.perform(post("/api/v1/calc/claims").param("observationId", observationId))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode claim = objectMapper.readTree(claimed.getResponse().getContentAsString());
        long token = claim.get("claimToken").asLong();
        long version = claim.get("snapshotVersion").asLong();

        mockMvc.perform(post("/api/v1/calc/claims").param("observationId", observationId))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/v1/calc/{id}/complete", observationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"claimToken\": " + token + ", \"snapshotVersion\": " + version
                                + ", \"result\": {\"itc\": 12}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("READY"));

        // A retried report is answered without touching the settled record
        mockMvc.perform(post("/api/v1/calc/{id}/complete", observationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"claimToken\": " + token + ", \"snapshotVersion\": " + version
                                + ", \"result\": {\"itc\": 99}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("NOT_APPLICABLE"));

        mockMvc.perform(get("/api/v1/observations/{id}/calc", observationId))
                .andExpect(jsonPath("$.state").value("READY"))
                .andExpect(jsonPath("$.result.itc").value(12));
    }

    @Test
    @DisplayName("Program change stream emits one event per state change")
    void changeStreamEmitsStateChanges() throws Exception {
        MvcResult stream = mockMvc.perform(get("/api/v1/programs/{id}/calc/events", programId))
                .andExpect(request().asyncStarted())
                .andReturn();

        invalidate();
        ClaimedCalc claim = obscalcService.claim(observationId).orElseThrow();

        String content = awaitContent(stream, "\"newState\":\"CALCULATING\"");
        assertTrue(content.contains("event:calc-state"), content);
        assertTrue(content.contains("\"newState\":\"PENDING\""), content);
        assertTrue(content.contains("\"observationId\":\"" + observationId + "\""), content);
        assertTrue(content.contains("\"ownerId\":\"" + programId + "\""), content);
        assertTrue(content.indexOf("\"newState\":\"PENDING\"")
                < content.indexOf("\"newState\":\"CALCULATING\""), content);

        obscalcService.release(claim.getObservationId());
    }

    @Test
    void transientFailureReportedOverHttpSchedulesRetry() throws Exception {
        invalidate();
        ClaimedCalc claim = obscalcService.claim(observationId).orElseThrow();

        mockMvc.perform(post("/api/v1/calc/{id}/fail", observationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"claimToken\": " + claim.getClaimToken()
                                + ", \"snapshotVersion\": " + claim.getSnapshotVersion()
                                + ", \"transient\": true, \"message\": \"calculator down\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("RETRY_SCHEDULED"))
                .andExpect(jsonPath("$.failureCount").value(1));
    }

    @Test
    void ownerInvalidationIsAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/invalidations/owners")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerKind\": \"PROGRAM\", \"ownerId\": \"" + programId + "\"}"))
                .andExpect(status().isAccepted());

        int queued = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM owner_sweep WHERE owner_id = ?", Integer.class, programId);
        assertEquals(1, queued);
    }

    @Test
    void unknownObservationAndInvalidRequests() throws Exception {
        mockMvc.perform(get("/api/v1/observations/{id}/calc", "o-unknown"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/v1/observations/{id}/calc", observationId))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/v1/invalidations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.observationId").exists());
    }

    @Test
    void healthReportsQueueDepth() throws Exception {
        invalidate();

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.records.OBSCALC.PENDING").isNumber());
    }
}
