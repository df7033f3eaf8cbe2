package com.histora.service.core.support;

import com.histora.service.core.datastore.DatastoreChange;
import com.histora.service.core.spi.KeyValueBackend;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.regex.Pattern;

public class InMemoryKeyValueBackend implements KeyValueBackend {

    private final Map<String, String> entries = new TreeMap<>();
    private final List<Consumer<DatastoreChange>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized Map<String, String> mget(Collection<String> keys) {
        Map<String, String> out = new LinkedHashMap<>();
        keys.forEach(key -> {
            String value = entries.get(key);
            if (value != null) {
                out.put(key, value);
            }
        });
        return out;
    }

    @Override
    public synchronized List<String> keys(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        Pattern compiled = Pattern.compile(regex.toString());
        List<String> out = new ArrayList<>();
        entries.keySet().stream().filter(k -> compiled.matcher(k).matches()).forEach(out::add);
        return out;
    }

    @Override
    public void set(Map<String, String> values) {
        synchronized (this) {
            entries.putAll(values);
        }
        listeners.forEach(l -> l.accept(DatastoreChange.changed(values)));
    }

    @Override
    public int delete(Collection<String> keys) {
        List<String> removed = new ArrayList<>();
        synchronized (this) {
            keys.forEach(key -> {
                if (entries.remove(key) != null) {
                    removed.add(key);
                }
            });
        }
        if (!removed.isEmpty()) {
            listeners.forEach(l -> l.accept(DatastoreChange.deleted(removed)));
        }
        return removed.size();
    }

    @Override
    public void ping() {}

    @Override
    public void addChangeListener(Consumer<DatastoreChange> listener) {
        listeners.add(listener);
    }
}
