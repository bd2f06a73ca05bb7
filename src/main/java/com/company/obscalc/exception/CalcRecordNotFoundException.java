package com.company.obscalc.exception;

public class CalcRecordNotFoundException extends RuntimeException {
    public CalcRecordNotFoundException(String observationId) {
        super("No calculation recorded for observation: " + observationId);
    }
}
