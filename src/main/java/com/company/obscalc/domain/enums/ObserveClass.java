package com.company.obscalc.domain.enums;

public enum ObserveClass {
    SCIENCE,
    PROGRAM_CAL,
    PARTNER_CAL,
    ACQUISITION,
    ACQUISITION_CAL,
    DAY_CAL
}
