package com.company.obscalc.domain;

import com.company.obscalc.domain.enums.CalcState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cached calculation state for one observation, one row per observation and kind.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CalcRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    // Primary key, also the foreign key to the owning observation
    private String observationId;
    private String programId;

    private CalcState state;

    // Staleness: lastInvalidation > lastUpdate (lastUpdate is null until the first result)
    private Instant lastInvalidation;
    private Instant lastUpdate;

    // Retry bookkeeping, only meaningful while RETRY or CALCULATING
    private Instant retryAt;
    private int failureCount;

    // Bumped by every effective invalidation; handed to workers as the snapshot version
    private long invalidationSeq;

    // Bumped by every claim; only the holder of the current claim may settle it
    private long claimSeq;

    // Lease start for the current claim
    private Instant claimedAt;

    // Opaque JSON payload and permanent failure message
    private String result;
    private String errorMessage;

    // Optimistic lock, bumped on every write
    private long rowVersion;

    /**
     * True until a computation that saw the latest invalidation has committed.
     */
    public boolean isStale() {
        if (state == null || !state.isSettled() || lastUpdate == null) {
            return true;
        }
        return lastInvalidation.isAfter(lastUpdate);
    }

    public boolean isClaimable(Instant now) {
        if (state == CalcState.PENDING) {
            return true;
        }
        return state == CalcState.RETRY && retryAt != null && !retryAt.isAfter(now);
    }
}
