package com.company.obscalc.service;

import com.company.obscalc.domain.CalcRecord;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.domain.enums.TransitionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CalcStateMachineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final RetryPolicy POLICY = new RetryPolicy(3, Duration.ofMinutes(1), Duration.ofHours(1), 5);

    private static Instant t(int minutes) {
        return T0.plus(Duration.ofMinutes(minutes));
    }

    private static CalcRecord pending(Instant at) {
        return CalcStateMachine.create("o-1", "p-1", at);
    }

    private static CalcRecord calculating(Instant invalidatedAt, Instant claimedAt) {
        return CalcStateMachine.claim(pending(invalidatedAt), claimedAt).getRecord();
    }

    private static CalcRecord ready(Instant invalidatedAt, Instant claimedAt, Instant completedAt) {
        CalcRecord claimed = calculating(invalidatedAt, claimedAt);
        return CalcStateMachine.complete(claimed, claimed.getClaimSeq(), claimed.getInvalidationSeq(), "{}", completedAt)
                .getRecord();
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        void createdRecordIsPendingAndStale() {
            CalcRecord created = pending(t(0));
            assertEquals(CalcState.PENDING, created.getState());
            assertEquals(1, created.getInvalidationSeq());
            assertTrue(created.isStale());
        }

        @Test
        @DisplayName("Pending record only moves forward in time")
        void pendingKeepsLatestTime() {
            CalcStateMachine.Step older = CalcStateMachine.invalidate(pending(t(5)), t(3));
            assertEquals(TransitionOutcome.UNCHANGED, older.getOutcome());
            assertFalse(older.isWrite());

            CalcStateMachine.Step newer = CalcStateMachine.invalidate(pending(t(5)), t(7));
            assertEquals(TransitionOutcome.INVALIDATED, newer.getOutcome());
            assertEquals(t(7), newer.getRecord().getLastInvalidation());
            assertEquals(2, newer.getRecord().getInvalidationSeq());
        }

        @Test
        @DisplayName("Calculating record keeps its state but bumps the token")
        void calculatingBumpsToken() {
            CalcRecord claimed = calculating(t(0), t(1));
            CalcStateMachine.Step step = CalcStateMachine.invalidate(claimed, t(2));

            assertEquals(CalcState.CALCULATING, step.getRecord().getState());
            assertEquals(claimed.getInvalidationSeq() + 1, step.getRecord().getInvalidationSeq());
            assertEquals(t(2), step.getRecord().getLastInvalidation());
            assertEquals(t(1), step.getRecord().getClaimedAt());
        }

        @Test
        @DisplayName("Calculating record ignores changes already in its snapshot")
        void calculatingIgnoresChangesBeforeClaim() {
            CalcRecord claimed = calculating(t(0), t(5));

            assertEquals(TransitionOutcome.UNCHANGED, CalcStateMachine.invalidate(claimed, t(3)).getOutcome());
            assertEquals(TransitionOutcome.UNCHANGED, CalcStateMachine.invalidate(claimed, t(5)).getOutcome());

            CalcRecord edited = CalcStateMachine.invalidate(claimed, t(6)).getRecord();
            assertEquals(claimed.getInvalidationSeq() + 1, edited.getInvalidationSeq());

            CalcStateMachine.Step duplicate = CalcStateMachine.invalidate(edited, t(6));
            assertEquals(TransitionOutcome.UNCHANGED, duplicate.getOutcome());
            assertEquals(edited.getInvalidationSeq(), duplicate.getRecord().getInvalidationSeq());
        }

        @Test
        @DisplayName("Ready record goes back to pending only for changes after its inputs")
        void readyRequiresNewerChange() {
            CalcRecord done = ready(t(0), t(1), t(2));

            assertEquals(TransitionOutcome.UNCHANGED, CalcStateMachine.invalidate(done, t(0)).getOutcome());
            assertEquals(TransitionOutcome.UNCHANGED, CalcStateMachine.invalidate(done, t(1)).getOutcome());

            CalcStateMachine.Step later = CalcStateMachine.invalidate(done, t(3));
            assertEquals(CalcState.PENDING, later.getRecord().getState());
            assertEquals("{}", later.getRecord().getResult());
            assertTrue(later.getRecord().isStale());
        }

        @Test
        @DisplayName("A change between claim and completion still invalidates the ready record")
        void lateNotificationInsideComputeWindow() {
            CalcRecord done = ready(t(0), t(10), t(12));
            CalcStateMachine.Step step = CalcStateMachine.invalidate(done, t(11));

            assertEquals(TransitionOutcome.INVALIDATED, step.getOutcome());
            assertEquals(CalcState.PENDING, step.getRecord().getState());
            assertEquals(t(11), step.getRecord().getLastInvalidation());
        }

        @Test
        @DisplayName("Invalidation overrides the backoff timer")
        void retryBecomesPending() {
            CalcRecord claimed = calculating(t(0), t(1));
            CalcRecord retry = CalcStateMachine.fail(claimed, claimed.getClaimSeq(), claimed.getInvalidationSeq(), true, "down", t(2), POLICY)
                    .getRecord();
            CalcStateMachine.Step step = CalcStateMachine.invalidate(retry, t(3));

            assertEquals(CalcState.PENDING, step.getRecord().getState());
            assertNull(step.getRecord().getRetryAt());
            assertEquals(0, step.getRecord().getFailureCount());
        }
    }

    @Nested
    @DisplayName("Claim and completion")
    class ClaimAndCompletion {

        @Test
        void claimOnlyPendingOrDueRetry() {
            CalcRecord claimed = calculating(t(0), t(1));
            assertEquals(TransitionOutcome.NOT_APPLICABLE, CalcStateMachine.claim(claimed, t(2)).getOutcome());

            CalcRecord retry = CalcStateMachine.fail(claimed, claimed.getClaimSeq(), claimed.getInvalidationSeq(), true, "down", t(2), POLICY)
                    .getRecord();
            assertEquals(t(3), retry.getRetryAt());
            assertEquals(TransitionOutcome.NOT_APPLICABLE, CalcStateMachine.claim(retry, t(2)).getOutcome());
            assertEquals(TransitionOutcome.CLAIMED, CalcStateMachine.claim(retry, t(3)).getOutcome());
        }

        @Test
        void completeWithCurrentTokenIsReady() {
            CalcRecord done = ready(t(0), t(1), t(2));
            assertEquals(CalcState.READY, done.getState());
            assertEquals(t(2), done.getLastUpdate());
            assertFalse(done.isStale());
            assertEquals(0, done.getFailureCount());
        }

        @Test
        @DisplayName("Stale token requeues and keeps the result as best effort")
        void completeWithStaleTokenRequeues() {
            CalcRecord claimed = calculating(t(0), t(1));
            long token = claimed.getInvalidationSeq();
            CalcRecord edited = CalcStateMachine.invalidate(claimed, t(2)).getRecord();

            CalcStateMachine.Step step = CalcStateMachine.complete(edited, edited.getClaimSeq(), token, "{\"v\":1}", t(3));
            assertEquals(TransitionOutcome.REQUEUED_STALE, step.getOutcome());
            assertEquals(CalcState.PENDING, step.getRecord().getState());
            assertEquals("{\"v\":1}", step.getRecord().getResult());
            assertNull(step.getRecord().getLastUpdate());
            assertTrue(step.getRecord().isStale());
        }

        @Test
        void everyClaimGetsANewClaimToken() {
            CalcRecord first = calculating(t(0), t(1));
            CalcRecord released = CalcStateMachine.release(first).getRecord();
            CalcRecord second = CalcStateMachine.claim(released, t(2)).getRecord();

            assertEquals(first.getClaimSeq() + 1, second.getClaimSeq());
            assertEquals(first.getInvalidationSeq(), second.getInvalidationSeq());
        }

        @Test
        @DisplayName("Report from a superseded claim leaves the current claim untouched")
        void reportFromSupersededClaimIsIgnored() {
            CalcRecord first = calculating(t(0), t(1));
            long staleClaim = first.getClaimSeq();
            long staleSnapshot = first.getInvalidationSeq();
            CalcRecord edited = CalcStateMachine.invalidate(first, t(2)).getRecord();
            CalcRecord requeued = CalcStateMachine.complete(edited, staleClaim, staleSnapshot, "{\"v\":1}", t(3))
                    .getRecord();
            CalcRecord second = CalcStateMachine.claim(requeued, t(4)).getRecord();

            CalcStateMachine.Step retried = CalcStateMachine.complete(second, staleClaim, staleSnapshot, "{\"v\":1}", t(5));
            assertEquals(TransitionOutcome.NOT_APPLICABLE, retried.getOutcome());
            assertSame(second, retried.getRecord());

            CalcStateMachine.Step failed = CalcStateMachine.fail(second, staleClaim, staleSnapshot, true, "down", t(5), POLICY);
            assertEquals(TransitionOutcome.NOT_APPLICABLE, failed.getOutcome());

            CalcStateMachine.Step done = CalcStateMachine.complete(second, second.getClaimSeq(),
                    second.getInvalidationSeq(), "{\"v\":2}", t(6));
            assertEquals(TransitionOutcome.READY, done.getOutcome());
            assertEquals("{\"v\":2}", done.getRecord().getResult());
        }

        @Test
        void completeOnlyWhileCalculating() {
            assertEquals(TransitionOutcome.NOT_APPLICABLE,
                    CalcStateMachine.complete(pending(t(0)), 0, 1, "{}", t(1)).getOutcome());
        }
    }

    @Nested
    @DisplayName("Failure")
    class Failure {

        @Test
        @DisplayName("Transient failures back off until retries run out, then fail terminally")
        void transientFailuresExhaustRetries() {
            CalcRecord record = pending(t(0));
            Instant now = t(1);

            for (int attempt = 1; attempt <= 3; attempt++) {
                record = CalcStateMachine.claim(record, now).getRecord();
                record = CalcStateMachine.fail(record, record.getClaimSeq(), record.getInvalidationSeq(),
                        true, "down", now, POLICY).getRecord();
                assertEquals(CalcState.RETRY, record.getState());
                assertEquals(attempt, record.getFailureCount());
                assertEquals(now.plus(POLICY.backoff(attempt - 1)), record.getRetryAt());
                now = record.getRetryAt();
            }

            record = CalcStateMachine.claim(record, now).getRecord();
            CalcStateMachine.Step last = CalcStateMachine.fail(record, record.getClaimSeq(), record.getInvalidationSeq(),
                    true, "down", now, POLICY);
            assertEquals(TransitionOutcome.FAILED, last.getOutcome());
            assertEquals(CalcState.FAILED, last.getRecord().getState());
            assertEquals("down", last.getRecord().getErrorMessage());
            assertEquals(0, last.getRecord().getFailureCount());
            assertNull(last.getRecord().getRetryAt());
        }

        @Test
        void permanentFailureIsTerminalAndClearsResult() {
            CalcRecord done = ready(t(0), t(1), t(2));
            CalcRecord again = CalcStateMachine.claim(CalcStateMachine.invalidate(done, t(3)).getRecord(), t(4)).getRecord();

            CalcStateMachine.Step step = CalcStateMachine.fail(again, again.getClaimSeq(), again.getInvalidationSeq(),
                    false, "bad input", t(5), POLICY);
            assertEquals(CalcState.FAILED, step.getRecord().getState());
            assertNull(step.getRecord().getResult());
            assertEquals(t(5), step.getRecord().getLastUpdate());
            assertFalse(step.getRecord().isStale());
        }

        @Test
        void failureWithStaleTokenRequeues() {
            CalcRecord claimed = calculating(t(0), t(1));
            long token = claimed.getInvalidationSeq();
            CalcRecord edited = CalcStateMachine.invalidate(claimed, t(2)).getRecord();

            CalcStateMachine.Step step = CalcStateMachine.fail(edited, edited.getClaimSeq(), token, false, "bad input", t(3), POLICY);
            assertEquals(TransitionOutcome.REQUEUED_STALE, step.getOutcome());
            assertEquals(CalcState.PENDING, step.getRecord().getState());
            assertNull(step.getRecord().getErrorMessage());
        }
    }

    @Nested
    @DisplayName("Release")
    class Release {

        @Test
        void releaseReturnsToPending() {
            CalcStateMachine.Step step = CalcStateMachine.release(calculating(t(0), t(1)));
            assertEquals(TransitionOutcome.RELEASED, step.getOutcome());
            assertEquals(CalcState.PENDING, step.getRecord().getState());
            assertNull(step.getRecord().getClaimedAt());
        }

        @Test
        void releaseOfRetryAttemptKeepsBackoffBookkeeping() {
            CalcRecord claimed = calculating(t(0), t(1));
            CalcRecord retry = CalcStateMachine.fail(claimed, claimed.getClaimSeq(), claimed.getInvalidationSeq(), true, "down", t(2), POLICY)
                    .getRecord();
            CalcRecord reclaimed = CalcStateMachine.claim(retry, t(3)).getRecord();

            CalcStateMachine.Step step = CalcStateMachine.release(reclaimed);
            assertEquals(CalcState.RETRY, step.getRecord().getState());
            assertEquals(1, step.getRecord().getFailureCount());
        }

        @Test
        void releaseIgnoresSettledRecords() {
            assertEquals(TransitionOutcome.NOT_APPLICABLE,
                    CalcStateMachine.release(ready(t(0), t(1), t(2))).getOutcome());
        }
    }
}
