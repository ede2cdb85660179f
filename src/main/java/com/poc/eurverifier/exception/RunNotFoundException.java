package com.poc.eurverifier.exception;

/**
 * Results in HTTP 404 Not Found
 */
public class RunNotFoundException extends VerificationException {

    public RunNotFoundException(Long runId) {
        super("RUN_NOT_FOUND", "Verification run not found with ID: " + runId);
    }

    public RunNotFoundException(String message) {
        super("RUN_NOT_FOUND", message);
    }
}
