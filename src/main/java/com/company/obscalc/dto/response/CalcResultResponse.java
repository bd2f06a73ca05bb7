package com.company.obscalc.dto.response;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * What a reader sees of a calculation. A result may be present while the
 * record is stale; it is then the previous best-effort value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalcResultResponse {
    private CalcKind kind;
    private String observationId;
    private String programId;
    private CalcState state;
    private boolean stale;
    private JsonNode result;
    private String errorMessage;
    private Instant lastInvalidation;
    private Instant lastUpdate;
    private Instant retryAt;
    private Integer failureCount;
}
