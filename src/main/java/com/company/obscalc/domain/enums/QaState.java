package com.company.obscalc.domain.enums;

/**
 * Dataset QA state. A null QA state counts as passing.
 */
public enum QaState {
    PASS,
    USABLE,
    FAIL;

    public static boolean isPassing(QaState state) {
        return state == null || state == PASS;
    }
}
