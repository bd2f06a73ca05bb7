package com.company.obscalc.domain.enums;

public enum OwnerKind {
    PROGRAM,
    CALL_FOR_PROPOSALS
}
