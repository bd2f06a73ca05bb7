package com.company.obscalc.scheduled;

import com.company.obscalc.service.CalcCacheService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Returns records claimed by workers that never reported back.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "obscalc.claims.reaper.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ClaimLeaseReaperJob {

    private final List<CalcCacheService> services;
    private final MeterRegistry meterRegistry;
    private final Duration lease;

    public ClaimLeaseReaperJob(@Qualifier("obscalcService") CalcCacheService obscalcService,
                               @Qualifier("telluricService") CalcCacheService telluricService,
                               MeterRegistry meterRegistry,
                               @Value("${obscalc.claims.lease:10m}") Duration lease) {
        this.services = List.of(obscalcService, telluricService);
        this.meterRegistry = meterRegistry;
        this.lease = lease;
    }

    @Scheduled(
            fixedDelayString = "${obscalc.claims.reaper.interval-ms:60000}",
            initialDelayString = "${obscalc.claims.reaper.initial-delay-ms:60000}"
    )
    public void reapExpiredClaims() {
        for (CalcCacheService service : services) {
            try {
                int released = service.releaseExpiredClaims(lease);
                if (released > 0) {
                    log.warn("Released {} expired {} claims (lease {})", released, service.getKind(), lease);
                    meterRegistry.counter("obscalc.claims.expired", "kind", service.getKind().name()).increment(released);
                }
            } catch (Exception e) {
                log.error("Claim lease reaper failed for {}", service.getKind(), e);
            }
        }
    }
}
