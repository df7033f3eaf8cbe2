package com.histora.service.core.bus;

import com.histora.service.core.spi.BusMessageHandler;
import com.histora.service.core.spi.MessageBus;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process bus for single-node setups and tests. Publishing delivers synchronously on the caller's thread; a
 * handler failure is logged and does not reach the publisher.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "histora.bus", name = "type", havingValue = "local")
public class LocalMessageBus implements MessageBus {

    private final Map<String, BusMessageHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void subscribe(String topic, BusMessageHandler handler) {
        handlers.put(topic, handler);
    }

    @Override
    public void unsubscribe(String topic) {
        handlers.remove(topic);
    }

    @Override
    public void publish(String topic, byte[] payload) {
        BusMessageHandler handler = handlers.get(topic);
        if (handler == null) {
            log.trace("No local subscriber for {}", topic);
            return;
        }
        try {
            handler.onMessage(topic, payload);
        } catch (RuntimeException ex) {
            log.error("Local subscriber for {} failed", topic, ex);
        }
    }

    public boolean isSubscribed(String topic) {
        return handlers.containsKey(topic);
    }
}
