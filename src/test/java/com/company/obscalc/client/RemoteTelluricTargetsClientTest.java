package com.company.obscalc.client;

import com.company.obscalc.domain.TelluricQuery;
import com.company.obscalc.domain.result.TelluricResolutionResult;
import com.company.obscalc.exception.CalculatorUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteTelluricTargetsClientTest {

    private static final String BASE_URL = "http://telluric.test";

    private MockRestServiceServer server;
    private RemoteTelluricTargetsClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE_URL).build();
        server = MockRestServiceServer.createServer(restTemplate);
        client = new RemoteTelluricTargetsClient(restTemplate);
    }

    private static TelluricQuery query() {
        return TelluricQuery.builder()
                .scienceObservationId("sci-1")
                .programId("p-1")
                .scienceTargetIds(List.of("t-1"))
                .build();
    }

    @Test
    void firstCandidateWins() {
        server.expect(requestTo(BASE_URL + "/telluric/search"))
                .andRespond(withSuccess("""
                        [{"targetId": "tel-1", "targetName": "HIP 1"}, {"targetId": "tel-2", "targetName": "HIP 2"}]
                        """, MediaType.APPLICATION_JSON));

        Optional<TelluricResolutionResult> found = client.search(query());

        assertEquals("tel-1", found.orElseThrow().getTargetId());
    }

    @Test
    void emptyAnswerAndNotFoundMeanNoStar() {
        server.expect(requestTo(BASE_URL + "/telluric/search"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));
        assertTrue(client.search(query()).isEmpty());

        server.reset();
        server.expect(requestTo(BASE_URL + "/telluric/search"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        assertTrue(client.search(query()).isEmpty());
    }

    @Test
    void serverErrorIsUnavailable() {
        server.expect(requestTo(BASE_URL + "/telluric/search")).andRespond(withServerError());

        assertThrows(CalculatorUnavailableException.class, () -> client.search(query()));
    }
}
