package com.company.obscalc.dto.response;

import com.company.obscalc.domain.CalcRecord;
import com.company.obscalc.domain.CalcTransition;
import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.domain.enums.TransitionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionResponse {
    private CalcKind kind;
    private String observationId;
    private CalcState previousState;
    private CalcState newState;
    private TransitionOutcome outcome;
    private boolean invalidatedMidFlight;
    private Instant lastInvalidation;
    private Instant retryAt;
    private Integer failureCount;

    public static TransitionResponse from(CalcTransition transition) {
        CalcRecord record = transition.getRecord();
        return TransitionResponse.builder()
                .kind(transition.getKind())
                .observationId(transition.getObservationId())
                .previousState(transition.getPreviousState())
                .newState(transition.getNewState())
                .outcome(transition.getOutcome())
                .invalidatedMidFlight(transition.isInvalidatedMidFlight())
                .lastInvalidation(record != null ? record.getLastInvalidation() : null)
                .retryAt(record != null ? record.getRetryAt() : null)
                .failureCount(record != null ? record.getFailureCount() : null)
                .build();
    }
}
