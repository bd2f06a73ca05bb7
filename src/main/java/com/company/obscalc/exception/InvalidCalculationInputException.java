package com.company.obscalc.exception;

/**
 * The calculator rejected the observation's inputs. Retrying with the same
 * inputs cannot succeed.
 */
public class InvalidCalculationInputException extends RuntimeException {
    public InvalidCalculationInputException(String message) {
        super(message);
    }
}
