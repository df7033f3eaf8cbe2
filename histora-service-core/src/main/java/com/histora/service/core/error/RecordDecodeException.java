package com.histora.service.core.error;

public class RecordDecodeException extends RuntimeException {

    private final String topic;

    public RecordDecodeException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public RecordDecodeException(String topic, String message) {
        this(topic, message, null);
    }

    public String topic() {
        return topic;
    }
}
