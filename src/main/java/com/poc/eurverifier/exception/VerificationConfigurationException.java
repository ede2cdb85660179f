package com.poc.eurverifier.exception;

/**
 * The requested column selection cannot be applied to the given grids.
 * Raised before any cell is compared.
 */
public class VerificationConfigurationException extends VerificationException {

    public VerificationConfigurationException(String message) {
        super("INVALID_COLUMNS", message);
    }
}
