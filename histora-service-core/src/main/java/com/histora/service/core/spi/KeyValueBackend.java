package com.histora.service.core.spi;

import com.histora.service.core.datastore.DatastoreChange;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Key/value store holding serialized documents. Every committed write is reported to the registered change
 * listeners.
 */
public interface KeyValueBackend {

    Optional<String> get(String key);

    /** @return values of the keys that exist, in the order of {@code keys}. */
    Map<String, String> mget(Collection<String> keys);

    /** @return keys matching a glob pattern ({@code *} and {@code ?}), sorted. */
    List<String> keys(String pattern);

    void set(Map<String, String> entries);

    int delete(Collection<String> keys);

    void ping();

    void addChangeListener(Consumer<DatastoreChange> listener);
}
