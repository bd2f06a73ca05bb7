package com.company.obscalc.dto.response;

import com.company.obscalc.domain.ClaimedCalc;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimResponse {
    private String observationId;
    private String programId;
    private long claimToken;
    private long snapshotVersion;
    private Instant claimedAt;
    private int failureCount;

    public static ClaimResponse from(ClaimedCalc claim) {
        return ClaimResponse.builder()
                .observationId(claim.getObservationId())
                .programId(claim.getProgramId())
                .claimToken(claim.getClaimToken())
                .snapshotVersion(claim.getSnapshotVersion())
                .claimedAt(claim.getClaimedAt())
                .failureCount(claim.getFailureCount())
                .build();
    }
}
