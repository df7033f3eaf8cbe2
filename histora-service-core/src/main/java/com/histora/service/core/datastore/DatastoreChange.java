package com.histora.service.core.datastore;

import java.util.List;
import java.util.Map;

/**
 * Committed key/value write. {@code changed} maps storage keys to their new serialized values; {@code deleted} lists
 * removed storage keys.
 */
public record DatastoreChange(Map<String, String> changed, List<String> deleted) {

    public DatastoreChange {
        changed = changed == null ? Map.of() : Map.copyOf(changed);
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
    }

    public static DatastoreChange changed(Map<String, String> changed) {
        return new DatastoreChange(changed, List.of());
    }

    public static DatastoreChange deleted(List<String> deleted) {
        return new DatastoreChange(Map.of(), deleted);
    }

    public boolean isEmpty() {
        return changed.isEmpty() && deleted.isEmpty();
    }
}
