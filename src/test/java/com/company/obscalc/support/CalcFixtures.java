package com.company.obscalc.support;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.repository.CalcRecordRepository;
import com.company.obscalc.service.CalcCacheService;
import com.company.obscalc.service.RetryPolicy;
import com.company.obscalc.event.CalcStateChangedEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

public final class CalcFixtures {

    private CalcFixtures() {
    }

    public static RetryPolicy defaultRetryPolicy() {
        return new RetryPolicy(3, Duration.ofMinutes(1), Duration.ofHours(1), 5);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    public static CalcCacheService service(TestDatabase db, CalcKind kind, RetryPolicy policy, Clock clock,
                                           List<CalcStateChangedEvent> events, MeterRegistry meterRegistry) {
        return new CalcCacheService(
                new CalcRecordRepository(db.jdbcTemplate(), kind),
                policy,
                clock,
                objectMapper(),
                event -> {
                    if (event instanceof CalcStateChangedEvent changed) {
                        events.add(changed);
                    }
                },
                meterRegistry);
    }
}
