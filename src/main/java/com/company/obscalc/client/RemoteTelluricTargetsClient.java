package com.company.obscalc.client;

import com.company.obscalc.domain.TelluricQuery;
import com.company.obscalc.domain.result.TelluricResolutionResult;
import com.company.obscalc.exception.CalculatorUnavailableException;
import com.company.obscalc.exception.InvalidCalculationInputException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

@Component
@Slf4j
public class RemoteTelluricTargetsClient implements TelluricTargetsClient {

    private static final String SEARCH_URI = "/telluric/search";

    private final RestTemplate restTemplate;

    public RemoteTelluricTargetsClient(@Qualifier("telluricTargetsRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    @CircuitBreaker(name = "telluricTargets")
    public Optional<TelluricResolutionResult> search(TelluricQuery query) {
        try {
            TelluricResolutionResult[] found = restTemplate.postForObject(SEARCH_URI, query, TelluricResolutionResult[].class);
            if (found == null || found.length == 0) {
                return Optional.empty();
            }
            log.debug("Telluric search for {} returned {} candidates", query.getScienceObservationId(), found.length);
            return Optional.of(found[0]);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new InvalidCalculationInputException(e.getResponseBodyAsString());
        } catch (HttpServerErrorException e) {
            throw new CalculatorUnavailableException("Telluric catalog error " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new CalculatorUnavailableException("Telluric catalog unreachable: " + e.getMessage(), e);
        }
    }
}
