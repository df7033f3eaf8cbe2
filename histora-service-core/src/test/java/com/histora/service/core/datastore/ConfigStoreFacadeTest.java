package com.histora.service.core.datastore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.histora.service.core.bus.LocalMessageBus;
import com.histora.service.core.error.ValidationException;
import com.histora.service.core.spi.MessageBus;
import com.histora.service.core.support.InMemoryKeyValueBackend;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigStoreFacadeTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final InMemoryKeyValueBackend backend = new InMemoryKeyValueBackend();
    private final LocalMessageBus bus = new LocalMessageBus();
    private final Map<String, List<JsonNode>> published = new TreeMap<>();
    private ConfigStoreFacade store;

    @BeforeEach
    void setUp() {
        store = new ConfigStoreFacade(backend, bus, mapper, "histora.datastore");
        store.start();
    }

    private void listen(String topic) {
        bus.subscribe(topic, (t, payload) -> {
            try {
                published.computeIfAbsent(t, k -> new ArrayList<>()).add(mapper.readTree(payload));
            } catch (IOException ex) {
                throw new IllegalStateException(ex);
            }
        });
    }

    private static DatastoreValue value(String namespace, String id, Object setting) {
        return new DatastoreValue(namespace, id).with("setting", setting);
    }

    @Test
    void setThenGetRoundTripsExtraProperties() {
        store.set(value("ui:dashboards", "main", 42));

        DatastoreValue loaded = store.get("ui:dashboards", "main").orElseThrow();

        assertThat(loaded.getNamespace()).isEqualTo("ui:dashboards");
        assertThat(loaded.getId()).isEqualTo("main");
        assertThat(loaded.getContent()).containsEntry("setting", 42);
        assertThat(store.get("ui:dashboards", "other")).isEmpty();
    }

    @Test
    void mgetCombinesIdsAndFilter() {
        store.mset(List.of(value("ui", "alpha", 1), value("ui", "beta", 2), value("ui", "gamma", 3), value("x", "alpha", 4)));

        assertThat(store.mget("ui", null, null)).extracting(DatastoreValue::getId).containsExactly("alpha", "beta", "gamma");
        assertThat(store.mget("ui", List.of("gamma"), "a*")).extracting(DatastoreValue::getId)
                .containsExactly("gamma", "alpha");
        assertThat(store.mget("ui", List.of("missing"), null)).isEmpty();
    }

    @Test
    void deleteCountsRemovedValues() {
        store.mset(List.of(value("ui", "a", 1), value("ui", "b", 2), value("ui", "c", 3)));

        assertThat(store.delete("ui", "a")).isEqualTo(1);
        assertThat(store.delete("ui", "a")).isZero();
        assertThat(store.mdelete("ui", null, "*")).isEqualTo(2);
        assertThat(store.mget("ui", null, null)).isEmpty();
    }

    @Test
    void invalidNamesAreRejected() {
        assertThatThrownBy(() -> store.set(value("ui", "bad/id", 1))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.get("ns*", "a")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.set(new DatastoreValue("ui", null))).isInstanceOf(ValidationException.class);
    }

    @Test
    void changesArePublishedPerTopLevelNamespace() {
        listen("histora.datastore.ui");
        listen("histora.datastore.spark");

        store.mset(List.of(value("ui:dash", "a", 1), value("spark", "b", 2)));
        store.delete("ui:dash", "a");

        assertThat(published.get("histora.datastore.ui")).hasSize(2);
        assertThat(published.get("histora.datastore.ui").get(0).get("changed").get(0).get("id").asText())
                .isEqualTo("a");
        assertThat(published.get("histora.datastore.ui").get(1).get("deleted").get(0).asText())
                .isEqualTo("ui:dash:a");
        assertThat(published.get("histora.datastore.spark")).singleElement()
                .satisfies(msg -> assertThat(msg.get("changed").get(0).get("setting").asInt()).isEqualTo(2));
    }

    @Test
    void publishFailureDoesNotFailWrite() {
        MessageBus failing = mock(MessageBus.class);
        doThrow(new IllegalStateException("bus down")).when(failing).publish(anyString(), any());
        ConfigStoreFacade guarded = new ConfigStoreFacade(backend, failing, mapper, "histora.datastore");
        guarded.start();

        guarded.set(value("ui", "a", 1));

        assertThat(guarded.get("ui", "a")).isPresent();
    }

    @Test
    void topicNamesAreSanitized() {
        assertThat(store.topicFor("")).isEqualTo("histora.datastore");
        assertThat(store.topicFor("my ns(1)")).isEqualTo("histora.datastore.my_ns_1_");
    }
}
