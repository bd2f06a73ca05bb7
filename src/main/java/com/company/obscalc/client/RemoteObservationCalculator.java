package com.company.obscalc.client;

import com.company.obscalc.domain.ObservationSnapshot;
import com.company.obscalc.domain.result.ObservationCalcResult;
import com.company.obscalc.exception.CalculatorUnavailableException;
import com.company.obscalc.exception.InvalidCalculationInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP adapter for the calculator service: {@code POST /calculate} with the
 * observation snapshot as body.
 */
@Component
@Slf4j
public class RemoteObservationCalculator implements ObservationCalculator {

    private static final String CALCULATE_URI = "/calculate";

    private final RestTemplate restTemplate;

    public RemoteObservationCalculator(@Qualifier("calculatorRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ObservationCalcResult calculate(ObservationSnapshot snapshot) {
        try {
            ObservationCalcResult result = restTemplate.postForObject(CALCULATE_URI, snapshot, ObservationCalcResult.class);
            if (result == null) {
                throw new CalculatorUnavailableException(
                        "Calculator returned no result for " + snapshot.getObservationId());
            }
            return result;
        } catch (HttpClientErrorException e) {
            String message = e.getResponseBodyAsString();
            log.debug("Calculator rejected {}: {} {}", snapshot.getObservationId(), e.getStatusCode(), message);
            throw new InvalidCalculationInputException(message.isBlank() ? e.getStatusText() : message);
        } catch (HttpServerErrorException e) {
            throw new CalculatorUnavailableException("Calculator error " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new CalculatorUnavailableException("Calculator unreachable: " + e.getMessage(), e);
        }
    }
}
