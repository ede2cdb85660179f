package com.poc.eurverifier.engine;

import lombok.Getter;

/**
 * Raised when a raw cell value cannot be read as a decimal number.
 * Callers treat it as a per-cell outcome, never as a failed run.
 */
@Getter
public class NonNumericValueException extends RuntimeException {

    private final transient Object rawValue;

    public NonNumericValueException(Object rawValue) {
        super("Not a numeric value: " + rawValue);
        this.rawValue = rawValue;
    }

    public NonNumericValueException(Object rawValue, Throwable cause) {
        super("Not a numeric value: " + rawValue, cause);
        this.rawValue = rawValue;
    }
}
