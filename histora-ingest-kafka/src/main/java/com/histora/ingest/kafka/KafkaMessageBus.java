package com.histora.ingest.kafka;

import com.histora.service.core.spi.BusMessageHandler;
import com.histora.service.core.spi.MessageBus;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Message bus on Kafka. Each subscribed topic gets its own listener container, started on subscribe and stopped on
 * unsubscribe. Container lifecycle calls run outside the topic map. Offsets are acknowledged after the handler returns, whether or not it succeeded.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "histora.bus", name = "type", havingValue = "kafka", matchIfMissing = true)
public class KafkaMessageBus implements MessageBus {

    private final ConcurrentKafkaListenerContainerFactory<String, byte[]> containerFactory;
    private final KafkaTemplate<String, byte[]> template;
    private final Map<String, ConcurrentMessageListenerContainer<String, byte[]>> containers =
            new ConcurrentHashMap<>();

    public KafkaMessageBus(
            ConcurrentKafkaListenerContainerFactory<String, byte[]> historaKafkaListenerFactory,
            KafkaTemplate<String, byte[]> historaKafkaTemplate) {
        this.containerFactory = historaKafkaListenerFactory;
        this.template = historaKafkaTemplate;
    }

    @Override
    public void subscribe(String topic, BusMessageHandler handler) {
        ConcurrentMessageListenerContainer<String, byte[]> container = containerFactory.createContainer(topic);
        container.setBeanName("histora-bus-" + topic);
        container.setupMessageListener(listener(handler));
        ConcurrentMessageListenerContainer<String, byte[]> previous = containers.put(topic, container);
        if (previous != null) {
            previous.stop();
        }
        container.start();
        if (containers.get(topic) != container) {
            // replaced or unsubscribed while starting
            container.stop();
            return;
        }
        log.info("Kafka subscription started for {}", topic);
    }

    @Override
    public void unsubscribe(String topic) {
        ConcurrentMessageListenerContainer<String, byte[]> container = containers.remove(topic);
        if (container != null) {
            container.stop();
            log.info("Kafka subscription stopped for {}", topic);
        }
    }

    @Override
    public void publish(String topic, byte[] payload) {
        template.send(topic, payload).whenComplete((result, ex) -> {
            if (ex != null) {
                log.warn("Kafka publish to {} failed: {}", topic, ex.getMessage());
            }
        });
    }

    public boolean isSubscribed(String topic) {
        return containers.containsKey(topic);
    }

    @PreDestroy
    public void stop() {
        for (String topic : new ArrayList<>(containers.keySet())) {
            unsubscribe(topic);
        }
    }

    static AcknowledgingMessageListener<String, byte[]> listener(BusMessageHandler handler) {
        return (ConsumerRecord<String, byte[]> record, Acknowledgment ack) -> {
            try {
                handler.onMessage(record.topic(), record.value());
            } catch (RuntimeException ex) {
                log.error("Handler for {} failed at offset {}", record.topic(), record.offset(), ex);
            } finally {
                if (ack != null) {
                    ack.acknowledge();
                }
            }
        };
    }
}
