package com.company.obscalc.service;

import com.company.obscalc.domain.CalcRecord;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.domain.enums.TransitionOutcome;
import com.company.obscalc.util.TimeUtils;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Transition rules for calculation records. Pure: every method returns a new
 * record and never touches the store.
 * <p>
 * Two tokens guard a report. The claim sequence names the claim: a report
 * carrying any other claim token comes from a superseded worker and is ignored.
 * The invalidation sequence is the snapshot token. Every effective
 * invalidation bumps it, so the claim holder whose snapshot token no longer
 * matches computed from outdated inputs and its result is not accepted as
 * current.
 */
public final class CalcStateMachine {

    private CalcStateMachine() {
    }

    @Getter
    @AllArgsConstructor
    public static class Step {
        private final CalcRecord record;
        private final TransitionOutcome outcome;

        public boolean isWrite() {
            return outcome != TransitionOutcome.UNCHANGED && outcome != TransitionOutcome.NOT_APPLICABLE;
        }

        static Step unchanged(CalcRecord record) {
            return new Step(record, TransitionOutcome.UNCHANGED);
        }

        static Step notApplicable(CalcRecord record) {
            return new Step(record, TransitionOutcome.NOT_APPLICABLE);
        }
    }

    public static CalcRecord create(String observationId, String programId, Instant at) {
        return CalcRecord.builder()
                .observationId(observationId)
                .programId(programId)
                .state(CalcState.PENDING)
                .lastInvalidation(at)
                .failureCount(0)
                .invalidationSeq(1)
                .rowVersion(0)
                .build();
    }

    public static Step invalidate(CalcRecord current, Instant at) {
        switch (current.getState()) {
            case CALCULATING: {
                // Changes up to the claim are in the worker's snapshot
                if (!TimeUtils.isAfter(at, current.getClaimedAt())
                        || !at.isAfter(current.getLastInvalidation())) {
                    return Step.unchanged(current);
                }
                // The running worker is left alone; its result will be demoted on completion
                CalcRecord next = current.toBuilder()
                        .lastInvalidation(TimeUtils.max(current.getLastInvalidation(), at))
                        .invalidationSeq(current.getInvalidationSeq() + 1)
                        .failureCount(0)
                        .retryAt(null)
                        .build();
                return new Step(next, TransitionOutcome.INVALIDATED);
            }
            case PENDING: {
                if (!at.isAfter(current.getLastInvalidation())) {
                    return Step.unchanged(current);
                }
                CalcRecord next = current.toBuilder()
                        .lastInvalidation(at)
                        .invalidationSeq(current.getInvalidationSeq() + 1)
                        .build();
                return new Step(next, TransitionOutcome.INVALIDATED);
            }
            case RETRY:
                // New input overrides the backoff timer
                return new Step(toPending(current, at), TransitionOutcome.INVALIDATED);
            case READY:
            case FAILED:
                if (!TimeUtils.isAfter(at, inputsAsOf(current))) {
                    return Step.unchanged(current);
                }
                return new Step(toPending(current, at), TransitionOutcome.INVALIDATED);
            default:
                throw new IllegalStateException("Unknown state " + current.getState());
        }
    }

    public static Step claim(CalcRecord current, Instant now) {
        if (!current.isClaimable(now)) {
            return Step.notApplicable(current);
        }
        CalcRecord next = current.toBuilder()
                .state(CalcState.CALCULATING)
                .claimSeq(current.getClaimSeq() + 1)
                .claimedAt(now)
                .build();
        return new Step(next, TransitionOutcome.CLAIMED);
    }

    public static Step complete(CalcRecord current, long claimToken, long snapshotVersion,
                                String result, Instant at) {
        if (!holdsClaim(current, claimToken)) {
            return Step.notApplicable(current);
        }

        if (snapshotVersion != current.getInvalidationSeq()) {
            // Keep the result as a best-effort value; lastUpdate stays behind so the record is stale
            CalcRecord next = current.toBuilder()
                    .state(CalcState.PENDING)
                    .result(result)
                    .errorMessage(null)
                    .failureCount(0)
                    .retryAt(null)
                    .claimedAt(null)
                    .build();
            return new Step(next, TransitionOutcome.REQUEUED_STALE);
        }

        CalcRecord next = current.toBuilder()
                .state(CalcState.READY)
                .lastUpdate(TimeUtils.max(at, current.getLastInvalidation()))
                .result(result)
                .errorMessage(null)
                .failureCount(0)
                .retryAt(null)
                .build();
        return new Step(next, TransitionOutcome.READY);
    }

    public static Step fail(CalcRecord current, long claimToken, long snapshotVersion, boolean transientFailure,
                            String message, Instant at, RetryPolicy policy) {
        if (!holdsClaim(current, claimToken)) {
            return Step.notApplicable(current);
        }

        if (snapshotVersion != current.getInvalidationSeq()) {
            CalcRecord next = current.toBuilder()
                    .state(CalcState.PENDING)
                    .errorMessage(null)
                    .failureCount(0)
                    .retryAt(null)
                    .claimedAt(null)
                    .build();
            return new Step(next, TransitionOutcome.REQUEUED_STALE);
        }

        int failures = current.getFailureCount();
        if (transientFailure && policy.shouldRetry(failures)) {
            CalcRecord next = current.toBuilder()
                    .state(CalcState.RETRY)
                    .failureCount(failures + 1)
                    .retryAt(at.plus(policy.backoff(failures)))
                    .errorMessage(null)
                    .claimedAt(null)
                    .build();
            return new Step(next, TransitionOutcome.RETRY_SCHEDULED);
        }

        CalcRecord next = current.toBuilder()
                .state(CalcState.FAILED)
                .lastUpdate(TimeUtils.max(at, current.getLastInvalidation()))
                .result(null)
                .errorMessage(message != null ? message : "Calculation failed")
                .failureCount(0)
                .retryAt(null)
                .build();
        return new Step(next, TransitionOutcome.FAILED);
    }

    /**
     * Give up a claim without an outcome, as after a restart or an expired lease.
     */
    public static Step release(CalcRecord current) {
        if (current.getState() != CalcState.CALCULATING) {
            return Step.notApplicable(current);
        }
        CalcRecord next;
        if (current.getRetryAt() != null) {
            next = current.toBuilder()
                    .state(CalcState.RETRY)
                    .claimedAt(null)
                    .build();
        } else {
            next = current.toBuilder()
                    .state(CalcState.PENDING)
                    .failureCount(0)
                    .claimedAt(null)
                    .build();
        }
        return new Step(next, TransitionOutcome.RELEASED);
    }

    /**
     * Time up to which upstream changes are reflected in a settled record. The
     * snapshot is read after the claim, so anything changed before the claim is
     * included.
     */
    public static Instant inputsAsOf(CalcRecord settled) {
        return settled.getClaimedAt() != null ? settled.getClaimedAt() : settled.getLastUpdate();
    }

    private static boolean holdsClaim(CalcRecord current, long claimToken) {
        return current.getState() == CalcState.CALCULATING && current.getClaimSeq() == claimToken;
    }

    private static CalcRecord toPending(CalcRecord current, Instant at) {
        return current.toBuilder()
                .state(CalcState.PENDING)
                .lastInvalidation(TimeUtils.max(current.getLastInvalidation(), at))
                .invalidationSeq(current.getInvalidationSeq() + 1)
                .errorMessage(null)
                .failureCount(0)
                .retryAt(null)
                .claimedAt(null)
                .build();
    }
}
