package com.histora.service.core.spi;

@FunctionalInterface
public interface BusMessageHandler {
    void onMessage(String topic, byte[] payload);
}
