package com.company.obscalc.config;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.repository.CalcRecordRepository;
import com.company.obscalc.service.CalcCacheService;
import com.company.obscalc.service.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * One store and one cache service per calculation kind. Both kinds share the
 * same machinery and differ only in table and retry policy.
 */
@Configuration
@Slf4j
public class CalcCacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CalcRecordRepository obscalcRepository(JdbcTemplate jdbcTemplate) {
        return new CalcRecordRepository(jdbcTemplate, CalcKind.OBSCALC);
    }

    @Bean
    public CalcRecordRepository telluricRepository(JdbcTemplate jdbcTemplate) {
        return new CalcRecordRepository(jdbcTemplate, CalcKind.TELLURIC);
    }

    @Bean
    public RetryPolicy obscalcRetryPolicy(
            @Value("${obscalc.retry.max-retries:3}") int maxRetries,
            @Value("${obscalc.retry.base-delay:1m}") Duration baseDelay,
            @Value("${obscalc.retry.max-delay:1h}") Duration maxDelay,
            @Value("${obscalc.retry.max-exponent:5}") int maxExponent) {
        RetryPolicy policy = new RetryPolicy(maxRetries, baseDelay, maxDelay, maxExponent);
        log.info("Observation calculation retry policy: {}", policy);
        return policy;
    }

    @Bean
    public RetryPolicy telluricRetryPolicy(
            @Value("${obscalc.telluric.retry.max-retries:5}") int maxRetries,
            @Value("${obscalc.telluric.retry.base-delay:30s}") Duration baseDelay,
            @Value("${obscalc.telluric.retry.max-delay:1h}") Duration maxDelay,
            @Value("${obscalc.telluric.retry.max-exponent:7}") int maxExponent) {
        RetryPolicy policy = new RetryPolicy(maxRetries, baseDelay, maxDelay, maxExponent);
        log.info("Telluric resolution retry policy: {}", policy);
        return policy;
    }

    @Bean
    public CalcCacheService obscalcService(@Qualifier("obscalcRepository") CalcRecordRepository repository,
                                           @Qualifier("obscalcRetryPolicy") RetryPolicy retryPolicy,
                                           Clock clock,
                                           ObjectMapper objectMapper,
                                           ApplicationEventPublisher eventPublisher,
                                           MeterRegistry meterRegistry) {
        return new CalcCacheService(repository, retryPolicy, clock, objectMapper, eventPublisher, meterRegistry);
    }

    @Bean
    public CalcCacheService telluricService(@Qualifier("telluricRepository") CalcRecordRepository repository,
                                            @Qualifier("telluricRetryPolicy") RetryPolicy retryPolicy,
                                            Clock clock,
                                            ObjectMapper objectMapper,
                                            ApplicationEventPublisher eventPublisher,
                                            MeterRegistry meterRegistry) {
        return new CalcCacheService(repository, retryPolicy, clock, objectMapper, eventPublisher, meterRegistry);
    }
}
