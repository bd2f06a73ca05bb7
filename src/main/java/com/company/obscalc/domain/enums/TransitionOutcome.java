package com.company.obscalc.domain.enums;

public enum TransitionOutcome {
    CREATED,
    INVALIDATED,
    UNCHANGED,
    CLAIMED,
    READY,
    REQUEUED_STALE,
    RETRY_SCHEDULED,
    FAILED,
    RELEASED,
    DELETED,
    NOT_APPLICABLE
}
