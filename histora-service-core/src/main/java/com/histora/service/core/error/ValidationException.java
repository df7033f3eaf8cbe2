package com.histora.service.core.error;

/** Malformed request input. Rejected before anything reaches a backend. */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
