package com.company.obscalc.domain.enums;

public enum WorkflowState {
    INACTIVE,
    UNDEFINED,
    UNAPPROVED,
    DEFINED,
    READY,
    ONGOING,
    COMPLETED
}
