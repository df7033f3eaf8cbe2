package com.histora.service.core.error;

/**
 * A time-series or key/value backend could not be reached or rejected the operation. Writes are retried by the
 * write buffer; queries surface this to the caller as a retryable failure.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public BackendUnavailableException(String message) {
        super(message);
    }
}
