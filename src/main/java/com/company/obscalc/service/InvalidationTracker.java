package com.company.obscalc.service;

import com.company.obscalc.domain.CalcTransition;
import com.company.obscalc.domain.OwnerRef;
import com.company.obscalc.domain.OwnerSweep;
import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.OwnerKind;
import com.company.obscalc.domain.enums.TransitionOutcome;
import com.company.obscalc.repository.ObservationDirectory;
import com.company.obscalc.repository.OwnerSweepRepository;
import com.company.obscalc.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for upstream changes. Single observations are marked dirty
 * immediately; owner-wide changes are queued and swept later.
 */
@Service
@Slf4j
public class InvalidationTracker {

    private final CalcCacheService obscalcService;
    private final ObservationDirectory observationDirectory;
    private final OwnerSweepRepository sweepRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public InvalidationTracker(@Qualifier("obscalcService") CalcCacheService obscalcService,
                               ObservationDirectory observationDirectory,
                               OwnerSweepRepository sweepRepository,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.obscalcService = obscalcService;
        this.observationDirectory = observationDirectory;
        this.sweepRepository = sweepRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Mark one observation dirty. Observations that no longer exist are
     * ignored.
     */
    public CalcTransition notifyChanged(String observationId, Instant changeTime) {
        Instant at = resolveTime(changeTime);

        Optional<String> programId = observationDirectory.programOf(observationId);
        if (programId.isEmpty()) {
            log.debug("Ignoring change for unknown observation {}", observationId);
            meterRegistry.counter("obscalc.invalidations.ignored").increment();
            return CalcTransition.notApplicable(CalcKind.OBSCALC, observationId, null);
        }

        CalcTransition transition = obscalcService.invalidate(observationId, programId.get(), at);
        meterRegistry.counter("obscalc.invalidations",
                "outcome", transition.getOutcome().name()
        ).increment();
        return transition;
    }

    /**
     * Queue a sweep over every observation under the owner. Repeated calls
     * before the sweep runs collapse into one.
     */
    public void notifyChangedForOwner(OwnerRef owner, Instant changeTime) {
        Instant at = resolveTime(changeTime);
        sweepRepository.enqueue(owner, at);
        meterRegistry.counter("obscalc.sweeps.queued", "owner_kind", owner.getKind().name()).increment();
        log.debug("Queued {} sweep for {} at {}", owner.getKind(), owner.getId(), at);
    }

    /**
     * Invalidate every observation covered by the sweep.
     *
     * @return the number of records whose state or token changed
     */
    public int applySweep(OwnerSweep sweep) {
        List<String> observationIds = observationsUnder(sweep.getOwner());

        int invalidated = 0;
        for (String observationId : observationIds) {
            CalcTransition transition = notifyChanged(observationId, sweep.getChangeTime());
            TransitionOutcome outcome = transition.getOutcome();
            if (outcome == TransitionOutcome.CREATED || outcome == TransitionOutcome.INVALIDATED) {
                invalidated++;
            }
        }

        log.info("Applied {} sweep for {}: {}/{} observations invalidated",
                sweep.getOwner().getKind(), sweep.getOwner().getId(), invalidated, observationIds.size());
        return invalidated;
    }

    private List<String> observationsUnder(OwnerRef owner) {
        if (owner.getKind() == OwnerKind.CALL_FOR_PROPOSALS) {
            return observationDirectory.observationsForCallForProposals(owner.getId());
        }
        return observationDirectory.observationsForProgram(owner.getId());
    }

    private Instant resolveTime(Instant changeTime) {
        return TimeUtils.toDbPrecision(changeTime != null ? changeTime : clock.instant());
    }
}
