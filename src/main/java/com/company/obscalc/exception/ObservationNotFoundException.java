package com.company.obscalc.exception;

public class ObservationNotFoundException extends RuntimeException {
    public ObservationNotFoundException(String observationId) {
        super("Observation not found: " + observationId);
    }
}
