package com.histora.service.core.datastore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.histora.service.core.config.HistoraProperties;
import com.histora.service.core.error.ValidationException;
import com.histora.service.core.spi.KeyValueBackend;
import com.histora.service.core.spi.MessageBus;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Namespaced access to the key/value backend. Committed writes are rebroadcast on the message bus, one message per
 * top-level namespace, on {@code <histora.datastore.topic>.<namespace>}.
 */
@Slf4j
@Service
public class ConfigStoreFacade {

    private final KeyValueBackend backend;
    private final MessageBus bus;
    private final ObjectMapper mapper;
    private final String topic;

    @Autowired
    public ConfigStoreFacade(
            KeyValueBackend backend, MessageBus bus, ObjectMapper mapper, HistoraProperties properties) {
        this(backend, bus, mapper, properties.getDatastore().getTopic());
    }

    ConfigStoreFacade(KeyValueBackend backend, MessageBus bus, ObjectMapper mapper, String topic) {
        this.backend = backend;
        this.bus = bus;
        this.mapper = mapper;
        this.topic = topic;
    }

    @PostConstruct
    public void start() {
        backend.addChangeListener(this::broadcast);
    }

    public Optional<DatastoreValue> get(String namespace, String id) {
        String key = DatastoreValue.keyOf(DatastoreValue.requireName("namespace", namespace), requireId(id));
        return backend.get(key).map(this::read);
    }

    /**
     * Values for the given ids plus those whose id matches {@code filter} ({@code *} and {@code ?} wildcards).
     * Without ids and filter every value in the namespace is returned.
     */
    public List<DatastoreValue> mget(String namespace, Collection<String> ids, String filter) {
        List<String> keys = resolveKeys(namespace, ids, filter);
        if (keys.isEmpty()) {
            return List.of();
        }
        List<DatastoreValue> values = new ArrayList<>();
        backend.mget(keys).values().forEach(json -> values.add(read(json)));
        return values;
    }

    public DatastoreValue set(DatastoreValue value) {
        return mset(List.of(value)).get(0);
    }

    public List<DatastoreValue> mset(List<DatastoreValue> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (DatastoreValue value : values) {
            if (value == null) {
                throw new ValidationException("Datastore value must not be null");
            }
            value.validate();
            entries.put(value.key(), write(value));
        }
        backend.set(entries);
        return List.copyOf(values);
    }

    public int delete(String namespace, String id) {
        String key = DatastoreValue.keyOf(DatastoreValue.requireName("namespace", namespace), requireId(id));
        return backend.delete(List.of(key));
    }

    public int mdelete(String namespace, Collection<String> ids, String filter) {
        List<String> keys = resolveKeys(namespace, ids, filter);
        return keys.isEmpty() ? 0 : backend.delete(keys);
    }

    public void ping() {
        backend.ping();
    }

    void broadcast(DatastoreChange change) {
        if (change.isEmpty()) {
            return;
        }
        Map<String, ArrayNode> changed = new TreeMap<>();
        change.changed().forEach((key, json) -> {
            try {
                changed.computeIfAbsent(topLevelNamespace(key), ns -> mapper.createArrayNode())
                        .add(mapper.readTree(json));
            } catch (JsonProcessingException ex) {
                log.warn("Skipping unreadable datastore value {} in change broadcast", key);
            }
        });
        Map<String, ArrayNode> deleted = new TreeMap<>();
        change.deleted()
                .forEach(key -> deleted.computeIfAbsent(topLevelNamespace(key), ns -> mapper.createArrayNode())
                        .add(key));

        changed.forEach((ns, nodes) -> publish(ns, "changed", nodes));
        deleted.forEach((ns, nodes) -> publish(ns, "deleted", nodes));
    }

    String topicFor(String namespace) {
        if (namespace.isEmpty()) {
            return topic;
        }
        return topic + "." + namespace.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    static String topLevelNamespace(String key) {
        int idx = key.indexOf(':');
        return idx < 0 ? "" : key.substring(0, idx);
    }

    private void publish(String namespace, String kind, JsonNode nodes) {
        ObjectNode message = mapper.createObjectNode();
        message.set(kind, nodes);
        String destination = topicFor(namespace);
        try {
            bus.publish(destination, mapper.writeValueAsBytes(message));
        } catch (JsonProcessingException | RuntimeException ex) {
            log.warn("Failed to publish datastore change to {}: {}", destination, ex.getMessage());
        }
    }

    private List<String> resolveKeys(String namespace, Collection<String> ids, String filter) {
        String ns = DatastoreValue.requireName("namespace", namespace);
        String pattern = ids == null && (filter == null || filter.isEmpty()) ? "*" : filter;

        Set<String> keys = new LinkedHashSet<>();
        if (ids != null) {
            ids.forEach(id -> keys.add(DatastoreValue.keyOf(ns, requireId(id))));
        }
        if (pattern != null && !pattern.isEmpty()) {
            keys.addAll(backend.keys(DatastoreValue.keyOf(ns, pattern)));
        }
        return new ArrayList<>(keys);
    }

    private static String requireId(String id) {
        if (id == null || id.isEmpty()) {
            throw new ValidationException("Datastore id must not be empty");
        }
        return DatastoreValue.requireName("id", id);
    }

    private DatastoreValue read(String json) {
        try {
            return mapper.readValue(json, DatastoreValue.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored datastore value is not valid JSON", ex);
        }
    }

    private String write(DatastoreValue value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Datastore value cannot be serialized: " + ex.getOriginalMessage(), ex);
        }
    }
}
