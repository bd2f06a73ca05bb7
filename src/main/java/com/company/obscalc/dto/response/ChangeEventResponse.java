package com.company.obscalc.dto.response;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.event.CalcStateChangedEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeEventResponse {
    private CalcKind kind;
    private String observationId;
    private String ownerId;
    private CalcState previousState;
    private CalcState newState;
    private Instant occurredAt;

    public static ChangeEventResponse from(CalcStateChangedEvent event) {
        return ChangeEventResponse.builder()
                .kind(event.getKind())
                .observationId(event.getObservationId())
                .ownerId(event.getProgramId())
                .previousState(event.getPreviousState())
                .newState(event.getNewState())
                .occurredAt(event.getOccurredAt())
                .build();
    }
}
