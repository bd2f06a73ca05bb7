package com.company.obscalc.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailCalcRequest {
    @NotNull(message = "Claim token is required")
    private Long claimToken;

    @NotNull(message = "Snapshot version from the claim is required")
    private Long snapshotVersion;

    // Transient failures are retried with backoff, others are terminal
    @JsonProperty("transient")
    private boolean transientFailure;

    private String message;
}
