package com.histora.service.storage.impl;

import com.histora.service.core.datastore.DatastoreChange;
import com.histora.service.core.error.BackendUnavailableException;
import com.histora.service.core.spi.KeyValueBackend;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/** Key/value store on the {@code datastore_entries} table. Change listeners run after the transaction commits. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JdbcKeyValueBackend implements KeyValueBackend {

    static final String UPSERT_SQL =
            """
            INSERT INTO datastore_entries (entry_key, entry_value, updated_at)
            VALUES (?, ?, now())
            ON CONFLICT (entry_key)
            DO UPDATE SET entry_value = EXCLUDED.entry_value, updated_at = EXCLUDED.updated_at
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate txTemplate;
    private final List<Consumer<DatastoreChange>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Optional<String> get(String key) {
        try {
            List<String> values = jdbc.queryForList(
                    "SELECT entry_value FROM datastore_entries WHERE entry_key = :key",
                    new MapSqlParameterSource("key", key),
                    String.class);
            return values.stream().findFirst();
        } catch (DataAccessException ex) {
            throw new BackendUnavailableException("Datastore read failed", ex);
        }
    }

    @Override
    public Map<String, String> mget(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Map.of();
        }
        Map<String, String> found = new HashMap<>();
        try {
            jdbc.query(
                    "SELECT entry_key, entry_value FROM datastore_entries WHERE entry_key IN (:keys)",
                    new MapSqlParameterSource("keys", List.copyOf(keys)),
                    rs -> {
                        found.put(rs.getString("entry_key"), rs.getString("entry_value"));
                    });
        } catch (DataAccessException ex) {
            throw new BackendUnavailableException("Datastore read failed", ex);
        }
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String key : keys) {
            String value = found.get(key);
            if (value != null) {
                ordered.put(key, value);
            }
        }
        return ordered;
    }

    @Override
    public List<String> keys(String pattern) {
        try {
            return jdbc.queryForList(
                    "SELECT entry_key FROM datastore_entries WHERE entry_key LIKE :pattern ESCAPE '\\' ORDER BY entry_key",
                    new MapSqlParameterSource("pattern", globToLike(pattern)),
                    String.class);
        } catch (DataAccessException ex) {
            throw new BackendUnavailableException("Datastore key scan failed", ex);
        }
    }

    @Override
    public void set(Map<String, String> entries) {
        if (entries.isEmpty()) {
            return;
        }
        List<Map.Entry<String, String>> rows = new ArrayList<>(entries.entrySet());
        try {
            txTemplate.execute(status -> {
                jdbc.getJdbcOperations().batchUpdate(UPSERT_SQL, new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        ps.setString(1, rows.get(i).getKey());
                        ps.setString(2, rows.get(i).getValue());
                    }

                    @Override
                    public int getBatchSize() {
                        return rows.size();
                    }
                });
                return null;
            });
        } catch (DataAccessException | TransactionException ex) {
            throw new BackendUnavailableException("Datastore write failed", ex);
        }
        notifyListeners(DatastoreChange.changed(entries));
    }

    @Override
    public int delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        List<String> deleted;
        try {
            deleted = txTemplate.execute(status -> jdbc.queryForList(
                    "DELETE FROM datastore_entries WHERE entry_key IN (:keys) RETURNING entry_key",
                    new MapSqlParameterSource("keys", List.copyOf(keys)),
                    String.class));
        } catch (DataAccessException | TransactionException ex) {
            throw new BackendUnavailableException("Datastore delete failed", ex);
        }
        if (deleted == null || deleted.isEmpty()) {
            return 0;
        }
        notifyListeners(DatastoreChange.deleted(deleted));
        return deleted.size();
    }

    @Override
    public void ping() {
        try {
            jdbc.getJdbcOperations().queryForObject("SELECT count(*) FROM datastore_entries", Long.class);
        } catch (DataAccessException ex) {
            throw new BackendUnavailableException("Datastore is unreachable", ex);
        }
    }

    @Override
    public void addChangeListener(Consumer<DatastoreChange> listener) {
        listeners.add(listener);
    }

    /** Translates a glob with {@code *} and {@code ?} into a LIKE pattern escaped with a backslash. */
    static String globToLike(String glob) {
        StringBuilder like = new StringBuilder(glob.length() + 8);
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> like.append('%');
                case '?' -> like.append('_');
                case '%', '_', '\\' -> like.append('\\').append(c);
                default -> like.append(c);
            }
        }
        return like.toString();
    }

    private void notifyListeners(DatastoreChange change) {
        for (Consumer<DatastoreChange> listener : listeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException ex) {
                log.error("Datastore change listener failed", ex);
            }
        }
    }
}
