package com.company.obscalc.domain.enums;

public enum CalcState {
    PENDING("Stale, waiting for a worker"),
    CALCULATING("Claimed by a worker"),
    READY("Result is current"),
    RETRY("Transient failure, waiting for the retry time"),
    FAILED("Permanent failure, waiting for new input");

    private final String description;

    CalcState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * States that hold a committed computation outcome.
     */
    public boolean isSettled() {
        return this == READY || this == FAILED;
    }

    /**
     * States in which failure_count and retry_at may hold non-default values.
     */
    public boolean carriesRetryFields() {
        return this == RETRY || this == CALCULATING;
    }

    public static CalcState fromString(String state) {
        if (state == null) {
            return PENDING;
        }
        try {
            return CalcState.valueOf(state.toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
