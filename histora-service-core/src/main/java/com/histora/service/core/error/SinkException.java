package com.histora.service.core.error;

/** A live-stream client could not accept a push. Closes that one subscription. */
public class SinkException extends Exception {

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }

    public SinkException(String message) {
        super(message);
    }
}
