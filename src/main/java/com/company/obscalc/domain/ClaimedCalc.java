package com.company.obscalc.domain;

import com.company.obscalc.domain.enums.CalcKind;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Exclusive right to compute one observation. The claim token and snapshot
 * version must be handed back on complete or fail.
 */
@Getter
@ToString
@AllArgsConstructor
public class ClaimedCalc {
    private final CalcKind kind;
    private final String observationId;
    private final String programId;
    private final long claimToken;
    private final long snapshotVersion;
    private final Instant lastInvalidation;
    private final Instant claimedAt;
    private final int failureCount;

    public static ClaimedCalc of(CalcKind kind, CalcRecord claimed) {
        return new ClaimedCalc(
                kind,
                claimed.getObservationId(),
                claimed.getProgramId(),
                claimed.getClaimSeq(),
                claimed.getInvalidationSeq(),
                claimed.getLastInvalidation(),
                claimed.getClaimedAt(),
                claimed.getFailureCount());
    }
}
