package com.histora.service.core.relay;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.buffer.WriteBuffer;
import com.histora.service.core.config.HistoraProperties;
import com.histora.service.core.error.RecordDecodeException;
import com.histora.service.core.error.ValidationException;
import com.histora.service.core.spi.BusMessageHandler;
import com.histora.service.core.spi.MessageBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

/**
 * Subscribes to history topics on the message bus and feeds decoded records into the write buffer. A message that
 * fails to decode is logged and dropped; the subscription stays alive.
 *
 * <p>Depends on the flush service so that on shutdown the relay unsubscribes before the final flush runs.
 */
@Slf4j
@Component
@DependsOn("writeBufferFlushService")
public class EventRelay implements BusMessageHandler {

    private final MessageBus bus;
    private final RecordDecoder decoder;
    private final WriteBuffer buffer;
    private final List<String> initialTopics;
    private final Set<String> topics = new ConcurrentSkipListSet<>();

    private final LongAdder received = new LongAdder();
    private final LongAdder relayed = new LongAdder();
    private final LongAdder rejected = new LongAdder();

    @Autowired
    public EventRelay(MessageBus bus, RecordDecoder decoder, WriteBuffer buffer, HistoraProperties properties) {
        this(bus, decoder, buffer, properties.getRelay().getTopics());
    }

    EventRelay(MessageBus bus, RecordDecoder decoder, WriteBuffer buffer, List<String> initialTopics) {
        this.bus = bus;
        this.decoder = decoder;
        this.buffer = buffer;
        this.initialTopics = initialTopics == null ? List.of() : List.copyOf(initialTopics);
    }

    @PostConstruct
    public void start() {
        initialTopics.forEach(this::subscribe);
        log.info("Event relay listening on {}", topics);
    }

    @PreDestroy
    public void stop() {
        for (String topic : new ArrayList<>(topics)) {
            unsubscribe(topic);
        }
    }

    /** @return true if the topic was not yet relayed. */
    public boolean subscribe(String topic) {
        String name = requireTopic(topic);
        if (!topics.add(name)) {
            return false;
        }
        try {
            bus.subscribe(name, this);
        } catch (RuntimeException ex) {
            topics.remove(name);
            throw ex;
        }
        log.debug("Relaying topic {}", name);
        return true;
    }

    public boolean unsubscribe(String topic) {
        String name = requireTopic(topic);
        if (!topics.remove(name)) {
            return false;
        }
        bus.unsubscribe(name);
        log.debug("Stopped relaying topic {}", name);
        return true;
    }

    public List<String> topics() {
        return List.copyOf(topics);
    }

    @Override
    public void onMessage(String topic, byte[] payload) {
        received.increment();
        try {
            List<MeasurementRecord> records = decoder.decode(topic, payload);
            buffer.enqueueAll(records);
            relayed.add(records.size());
        } catch (RecordDecodeException ex) {
            rejected.increment();
            log.warn("Dropping message on {}: {}", ex.topic(), ex.getMessage());
        } catch (RuntimeException ex) {
            rejected.increment();
            log.error("Failed to relay message on {}", topic, ex);
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(topics(), received.sum(), relayed.sum(), rejected.sum());
    }

    private static String requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("Topic must not be blank");
        }
        return topic.trim();
    }

    public record Snapshot(List<String> topics, long messagesReceived, long recordsRelayed, long messagesRejected) {}
}
