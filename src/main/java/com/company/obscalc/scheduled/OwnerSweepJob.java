package com.company.obscalc.scheduled;

import com.company.obscalc.domain.OwnerSweep;
import com.company.obscalc.repository.OwnerSweepRepository;
import com.company.obscalc.service.InvalidationTracker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Applies queued owner-wide invalidations (program and call for proposals
 * changes) to the observations they cover.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "obscalc.sweep.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class OwnerSweepJob {

    private final OwnerSweepRepository sweepRepository;
    private final InvalidationTracker invalidationTracker;
    private final MeterRegistry meterRegistry;

    @Value("${obscalc.sweep.batch-size:50}")
    private int batchSize = 50;

    @Scheduled(
            fixedDelayString = "${obscalc.sweep.interval-ms:2000}",
            initialDelayString = "${obscalc.sweep.initial-delay-ms:5000}"
    )
    public void sweep() {
        try {
            sweepOnce();
        } catch (Exception e) {
            log.error("Owner sweep failed", e);
            meterRegistry.counter("obscalc.sweeps.failures").increment();
        }
    }

    /**
     * @return the number of sweeps completed and removed
     */
    public int sweepOnce() {
        Instant startTime = Instant.now();
        List<OwnerSweep> batch = sweepRepository.findBatch(batchSize);
        if (batch.isEmpty()) {
            return 0;
        }

        int completed = 0;
        for (OwnerSweep sweep : batch) {
            invalidationTracker.applySweep(sweep);

            // A newer change queued meanwhile keeps the row for the next round
            if (sweepRepository.deleteIfUnchanged(sweep)) {
                completed++;
            }
        }

        Duration executionTime = Duration.between(startTime, Instant.now());
        log.info("Owner sweep completed: {}/{} sweeps done in {}ms", completed, batch.size(), executionTime.toMillis());
        meterRegistry.counter("obscalc.sweeps.completed").increment(completed);
        meterRegistry.timer("obscalc.sweeps.duration").record(executionTime);
        return completed;
    }
}
