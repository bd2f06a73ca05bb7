package com.company.obscalc.exception;

/**
 * A remote calculator could not be reached or answered with a server error.
 */
public class CalculatorUnavailableException extends RuntimeException {
    public CalculatorUnavailableException(String message) {
        super(message);
    }

    public CalculatorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
