package com.company.obscalc.client;

import com.company.obscalc.domain.ObservationSnapshot;
import com.company.obscalc.domain.result.ObservationCalcResult;
import com.company.obscalc.exception.CalculatorUnavailableException;
import com.company.obscalc.exception.InvalidCalculationInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteObservationCalculatorTest {

    private static final String BASE_URL = "http://calculator.test";

    private MockRestServiceServer server;
    private RemoteObservationCalculator calculator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE_URL).build();
        server = MockRestServiceServer.createServer(restTemplate);
        calculator = new RemoteObservationCalculator(restTemplate);
    }

    private static ObservationSnapshot snapshot() {
        return ObservationSnapshot.builder()
                .observationId("o-1")
                .programId("p-1")
                .observingMode("GMOS_NORTH_LONG_SLIT")
                .targets(List.of(new ObservationSnapshot.TargetRef("t-1", "NGC 1068", "PRESENT")))
                .build();
    }

    @Test
    void postsSnapshotAndReadsResult() {
        server.expect(requestTo(BASE_URL + "/calculate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.observationId").value("o-1"))
                .andExpect(jsonPath("$.targets[0].targetId").value("t-1"))
                .andRespond(withSuccess("""
                        {"workflow": {"state": "DEFINED", "validTransitions": [], "validationErrors": []}}
                        """, MediaType.APPLICATION_JSON));

        ObservationCalcResult result = calculator.calculate(snapshot());

        assertNotNull(result.getWorkflow());
        server.verify();
    }

    @Test
    void clientErrorIsInvalidInput() {
        server.expect(requestTo(BASE_URL + "/calculate"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .contentType(MediaType.TEXT_PLAIN)
                        .body("Target has no brightness"));

        InvalidCalculationInputException ex = assertThrows(InvalidCalculationInputException.class,
                () -> calculator.calculate(snapshot()));
        assertEquals("Target has no brightness", ex.getMessage());
    }

    @Test
    void serverErrorIsUnavailable() {
        server.expect(requestTo(BASE_URL + "/calculate")).andRespond(withServerError());

        assertThrows(CalculatorUnavailableException.class, () -> calculator.calculate(snapshot()));
    }
}
