package com.company.obscalc.domain.enums;

public enum ExecutionState {
    NOT_DEFINED,
    NOT_STARTED,
    ONGOING,
    COMPLETED
}
