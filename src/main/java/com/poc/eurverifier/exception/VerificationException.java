package com.poc.eurverifier.exception;

import lombok.Getter;

/**
 * Base exception for verification failures that carry an API error code.
 */
@Getter
public class VerificationException extends RuntimeException {

    private final String errorCode;

    public VerificationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public VerificationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
