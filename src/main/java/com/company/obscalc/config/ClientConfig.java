package com.company.obscalc.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class ClientConfig {

    @Bean
    public RestTemplate calculatorRestTemplate(
            RestTemplateBuilder builder,
            @Value("${obscalc.calculator.base-url}") String baseUrl,
            @Value("${obscalc.worker.compute-timeout:60s}") Duration computeTimeout) {
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(computeTimeout)
                .build();
    }

    @Bean
    public RestTemplate telluricTargetsRestTemplate(
            RestTemplateBuilder builder,
            @Value("${obscalc.telluric-targets.base-url}") String baseUrl) {
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public CircuitBreaker calculatorCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("obscalcCalculator");
    }

    @Bean
    public TimeLimiter calculatorTimeLimiter(TimeLimiterRegistry registry) {
        return registry.timeLimiter("obscalcCalculator");
    }
}
