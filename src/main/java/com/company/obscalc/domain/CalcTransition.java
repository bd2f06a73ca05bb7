package com.company.obscalc.domain;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.domain.enums.TransitionOutcome;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What a store operation did to a record. Operations never throw for expected
 * races; a lost claim or a stale token is reported here instead.
 */
@Getter
@ToString
@AllArgsConstructor
public class CalcTransition {
    private final CalcKind kind;
    private final String observationId;
    private final CalcState previousState;
    private final CalcState newState;
    private final TransitionOutcome outcome;
    private final CalcRecord record;

    public static CalcTransition notApplicable(CalcKind kind, String observationId, CalcRecord current) {
        CalcState state = current != null ? current.getState() : null;
        return new CalcTransition(kind, observationId, state, state, TransitionOutcome.NOT_APPLICABLE, current);
    }

    public boolean isStateChanged() {
        return previousState != newState;
    }

    /**
     * True when the record was invalidated again while the reporting worker was
     * computing, so its result was not accepted as current.
     */
    public boolean isInvalidatedMidFlight() {
        return outcome == TransitionOutcome.REQUEUED_STALE;
    }

    public String getProgramId() {
        return record != null ? record.getProgramId() : null;
    }
}
