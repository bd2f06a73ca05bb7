package com.company.obscalc.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteCalcRequest {
    @NotNull(message = "Claim token is required")
    private Long claimToken;

    @NotNull(message = "Snapshot version from the claim is required")
    private Long snapshotVersion;

    @NotNull(message = "Result is required")
    private JsonNode result;
}
