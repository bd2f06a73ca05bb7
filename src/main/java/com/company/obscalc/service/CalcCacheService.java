package com.company.obscalc.service;

import com.company.obscalc.domain.CalcRecord;
import com.company.obscalc.domain.CalcTransition;
import com.company.obscalc.domain.ClaimedCalc;
import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.domain.enums.TransitionOutcome;
import com.company.obscalc.event.CalcStateChangedEvent;
import com.company.obscalc.repository.CalcRecordRepository;
import com.company.obscalc.util.TimeUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Store contract for one calculation kind: lazy creation on invalidation,
 * compare-and-set claims and token-checked completion.
 * <p>
 * Expected races never surface as exceptions. A lost claim is an empty
 * {@link Optional}; a stale token or a missing record is reported through the
 * returned {@link CalcTransition}. Store failures propagate as Spring
 * {@code DataAccessException}.
 */
@Slf4j
public class CalcCacheService {

    private static final int MAX_CAS_ATTEMPTS = 10;
    private static final int EXPIRED_CLAIM_BATCH = 100;

    private final CalcRecordRepository repository;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final CalcKind kind;

    public CalcCacheService(CalcRecordRepository repository,
                            RetryPolicy retryPolicy,
                            Clock clock,
                            ObjectMapper objectMapper,
                            ApplicationEventPublisher eventPublisher,
                            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.kind = repository.getKind();
    }

    public CalcKind getKind() {
        return kind;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Optional<CalcRecord> get(String observationId) {
        return repository.find(observationId);
    }

    public List<CalcRecord> getByProgram(String programId) {
        return repository.findByProgram(programId);
    }

    /**
     * Mark the observation's result dirty as of {@code changeTime}, creating
     * the record in PENDING when it does not exist yet.
     */
    public CalcTransition invalidate(String observationId, String programId, Instant changeTime) {
        Instant at = TimeUtils.toDbPrecision(changeTime != null ? changeTime : clock.instant());

        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Optional<CalcRecord> current = repository.find(observationId);

            if (current.isEmpty()) {
                CalcRecord created = CalcStateMachine.create(observationId, programId, at);
                try {
                    repository.insert(created);
                } catch (DuplicateKeyException e) {
                    log.debug("{} record for {} created concurrently, retrying as update", kind, observationId);
                    recordConflict("invalidate");
                    continue;
                }
                CalcTransition transition = new CalcTransition(
                        kind, observationId, null, CalcState.PENDING, TransitionOutcome.CREATED, created);
                committed(transition);
                return transition;
            }

            CalcTransition transition = tryApply(current.get(), r -> CalcStateMachine.invalidate(r, at));
            if (transition != null) {
                return transition;
            }
        }

        throw casExhausted("invalidate", observationId);
    }

    /**
     * Claim a specific observation. Empty when it is not claimable or another
     * worker won the race.
     */
    public Optional<ClaimedCalc> claim(String observationId) {
        Instant now = now();
        CalcTransition transition = apply(observationId, "claim", r -> CalcStateMachine.claim(r, now));
        if (transition.getOutcome() != TransitionOutcome.CLAIMED) {
            return Optional.empty();
        }
        return Optional.of(ClaimedCalc.of(kind, transition.getRecord()));
    }

    /**
     * Claim the claimable record with the oldest invalidation.
     */
    public Optional<ClaimedCalc> claimNext() {
        List<ClaimedCalc> claimed = claimBatch(1);
        return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
    }

    public List<ClaimedCalc> claimBatch(int max) {
        List<ClaimedCalc> claimed = new ArrayList<>();
        if (max <= 0) {
            return claimed;
        }

        List<CalcRecord> candidates = repository.findClaimable(now(), max * 2);
        for (CalcRecord candidate : candidates) {
            if (claimed.size() >= max) {
                break;
            }
            claim(candidate.getObservationId()).ifPresent(claimed::add);
        }
        return claimed;
    }

    public CalcTransition complete(ClaimedCalc claim, Object result) {
        return complete(claim.getObservationId(), claim.getClaimToken(), claim.getSnapshotVersion(), result);
    }

    /**
     * Settle a claim with a result. A report from anyone but the current claim
     * holder is {@code NOT_APPLICABLE} and leaves the record untouched, so a
     * retried or late report never disturbs a newer claim.
     */
    public CalcTransition complete(String observationId, long claimToken, long snapshotVersion, Object result) {
        Instant at = now();
        String payload = serialize(result);
        CalcTransition transition = apply(observationId, "complete",
                r -> CalcStateMachine.complete(r, claimToken, snapshotVersion, payload, at));

        if (transition.isInvalidatedMidFlight()) {
            log.info("{} result for {} superseded by a newer invalidation, requeued", kind, observationId);
        } else if (transition.getOutcome() == TransitionOutcome.NOT_APPLICABLE) {
            log.info("{} result for {} ignored, claim {} is no longer current", kind, observationId, claimToken);
        }
        return transition;
    }

    public CalcTransition fail(ClaimedCalc claim, boolean transientFailure, String message) {
        return fail(claim.getObservationId(), claim.getClaimToken(), claim.getSnapshotVersion(),
                transientFailure, message);
    }

    public CalcTransition fail(String observationId, long claimToken, long snapshotVersion,
                               boolean transientFailure, String message) {
        Instant at = now();
        CalcTransition transition = apply(observationId, "fail",
                r -> CalcStateMachine.fail(r, claimToken, snapshotVersion, transientFailure, message, at, retryPolicy));

        TransitionOutcome outcome = transition.getOutcome();
        if (outcome == TransitionOutcome.RETRY_SCHEDULED) {
            log.warn("{} calculation for {} failed (attempt {}), retry at {}: {}",
                    kind, observationId, transition.getRecord().getFailureCount(),
                    transition.getRecord().getRetryAt(), message);
        } else if (outcome == TransitionOutcome.FAILED) {
            log.error("{} calculation for {} failed permanently: {}", kind, observationId, message);
        } else {
            log.debug("{} failure report for {} ended in {}", kind, observationId, outcome);
        }
        return transition;
    }

    public CalcTransition release(String observationId) {
        return apply(observationId, "release", CalcStateMachine::release);
    }

    /**
     * Return every CALCULATING record to the queue. Only safe while no worker
     * of this kind is running, i.e. at startup.
     */
    public int resetCalculating() {
        int released = 0;
        for (CalcRecord record : repository.findCalculating()) {
            if (release(record.getObservationId()).getOutcome() == TransitionOutcome.RELEASED) {
                released++;
            }
        }
        if (released > 0) {
            log.info("Reset {} {} records left calculating by a previous run", released, kind);
        }
        return released;
    }

    /**
     * Release claims older than the lease, for workers that died mid-compute.
     */
    public int releaseExpiredClaims(Duration lease) {
        Instant cutoff = now().minus(lease);
        int released = 0;

        for (CalcRecord expired : repository.findExpiredClaims(cutoff, EXPIRED_CLAIM_BATCH)) {
            Instant claimedAt = expired.getClaimedAt();
            CalcTransition transition = apply(expired.getObservationId(), "release", r ->
                    Objects.equals(r.getClaimedAt(), claimedAt)
                            ? CalcStateMachine.release(r)
                            : new CalcStateMachine.Step(r, TransitionOutcome.NOT_APPLICABLE));
            if (transition.getOutcome() == TransitionOutcome.RELEASED) {
                log.warn("{} claim on {} taken at {} expired, released", kind, expired.getObservationId(), claimedAt);
                released++;
            }
        }
        return released;
    }

    public boolean delete(String observationId) {
        boolean deleted = repository.delete(observationId);
        if (deleted) {
            log.debug("Deleted {} record for {}", kind, observationId);
            count(TransitionOutcome.DELETED);
        }
        return deleted;
    }

    public Map<CalcState, Long> countByState() {
        return repository.countByState();
    }

    public <T> Optional<T> readResult(CalcRecord record, Class<T> type) {
        if (record == null || record.getResult() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(record.getResult(), type));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} result stored for {}", kind, record.getObservationId(), e);
            return Optional.empty();
        }
    }

    private CalcTransition apply(String observationId, String operation,
                                 Function<CalcRecord, CalcStateMachine.Step> rule) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Optional<CalcRecord> current = repository.find(observationId);
            if (current.isEmpty()) {
                return CalcTransition.notApplicable(kind, observationId, null);
            }

            CalcTransition transition = tryApply(current.get(), rule);
            if (transition != null) {
                return transition;
            }
            recordConflict(operation);
        }

        throw casExhausted(operation, observationId);
    }

    // Null when the row changed under us
    private CalcTransition tryApply(CalcRecord current, Function<CalcRecord, CalcStateMachine.Step> rule) {
        CalcStateMachine.Step step = rule.apply(current);

        if (!step.isWrite()) {
            return new CalcTransition(kind, current.getObservationId(),
                    current.getState(), current.getState(), step.getOutcome(), current);
        }

        CalcRecord next = step.getRecord();
        if (!repository.compareAndSet(current.getRowVersion(), next)) {
            return null;
        }

        CalcTransition transition = new CalcTransition(kind, current.getObservationId(),
                current.getState(), next.getState(), step.getOutcome(), next);
        committed(transition);
        return transition;
    }

    private void committed(CalcTransition transition) {
        count(transition.getOutcome());

        if (transition.isStateChanged()) {
            eventPublisher.publishEvent(new CalcStateChangedEvent(
                    kind,
                    transition.getObservationId(),
                    transition.getProgramId(),
                    transition.getPreviousState(),
                    transition.getNewState(),
                    now()));
        }
    }

    private void count(TransitionOutcome outcome) {
        meterRegistry.counter("obscalc.transitions",
                "kind", kind.name(),
                "outcome", outcome.name()
        ).increment();
    }

    private void recordConflict(String operation) {
        meterRegistry.counter("obscalc.cas.conflicts",
                "kind", kind.name(),
                "operation", operation
        ).increment();
    }

    private OptimisticLockingFailureException casExhausted(String operation, String observationId) {
        return new OptimisticLockingFailureException(String.format(
                "Gave up %s on %s record %s after %d concurrent modifications",
                operation, kind, observationId, MAX_CAS_ATTEMPTS));
    }

    private String serialize(Object result) {
        if (result == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Result cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private Instant now() {
        return TimeUtils.toDbPrecision(clock.instant());
    }
}
