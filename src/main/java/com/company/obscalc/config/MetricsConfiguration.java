package com.company.obscalc.config;

import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.repository.OwnerSweepRepository;
import com.company.obscalc.service.CalcCacheService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Record counts per kind and state, and the sweep backlog.
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    @Bean
    public MeterBinder calcStateMetrics(@Qualifier("obscalcService") CalcCacheService obscalcService,
                                        @Qualifier("telluricService") CalcCacheService telluricService,
                                        OwnerSweepRepository sweepRepository) {
        return (reg) -> {
            for (CalcCacheService service : List.of(obscalcService, telluricService)) {
                for (CalcState state : CalcState.values()) {
                    Gauge.builder("obscalc.records", service, s -> countSafely(s, state))
                            .description("Calculation records by state")
                            .tag("kind", service.getKind().name())
                            .tag("state", state.name())
                            .register(reg);
                }
            }

            Gauge.builder("obscalc.sweeps.pending", sweepRepository, repo -> {
                        try {
                            return repo.countPending();
                        } catch (Exception e) {
                            log.warn("Failed to count pending sweeps", e);
                            return 0;
                        }
                    })
                    .description("Owner sweeps waiting to be applied")
                    .register(reg);

            log.info("Calculation metrics registered");
        };
    }

    private static double countSafely(CalcCacheService service, CalcState state) {
        try {
            return service.countByState().getOrDefault(state, 0L);
        } catch (Exception e) {
            log.warn("Failed to count {} records in state {}", service.getKind(), state, e);
            return 0;
        }
    }
}
