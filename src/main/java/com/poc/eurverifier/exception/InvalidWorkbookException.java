package com.poc.eurverifier.exception;

public class InvalidWorkbookException extends VerificationException {

    public InvalidWorkbookException(String message) {
        super("INVALID_WORKBOOK", message);
    }

    public InvalidWorkbookException(String message, Throwable cause) {
        super("INVALID_WORKBOOK", message, cause);
    }
}
