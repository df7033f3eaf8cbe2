package com.histora.service.core.spi;

/** Publish/subscribe message bus. One handler per topic. */
public interface MessageBus {

    void subscribe(String topic, BusMessageHandler handler);

    void unsubscribe(String topic);

    void publish(String topic, byte[] payload);
}
