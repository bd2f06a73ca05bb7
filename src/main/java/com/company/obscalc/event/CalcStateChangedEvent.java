package com.company.obscalc.event;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Published after a calculation record changed state. Subscribers should
 * re-read the record rather than trust this payload; delivery may repeat or
 * arrive out of order.
 */
@Getter
@ToString
@AllArgsConstructor
public class CalcStateChangedEvent {
    private final CalcKind kind;
    private final String observationId;
    private final String programId;

    // Null when the record was just created
    private final CalcState previousState;
    private final CalcState newState;
    private final Instant occurredAt;
}
