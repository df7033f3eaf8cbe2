package com.histora.service.core.datastore;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.histora.service.core.error.ValidationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/** Stored document: a namespace, an id and any other JSON properties the client sends. */
@JsonPropertyOrder({"namespace", "id"})
public class DatastoreValue {

    static final Pattern NAME_PATTERN = Pattern.compile("^[\\w\\-\\.\\:~_ \\(\\)]*$");

    private String namespace = "";
    private String id;
    private final Map<String, Object> content = new LinkedHashMap<>();

    public DatastoreValue() {}

    public DatastoreValue(String namespace, String id) {
        this.namespace = namespace == null ? "" : namespace;
        this.id = id;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace == null ? "" : namespace;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @JsonAnyGetter
    public Map<String, Object> getContent() {
        return content;
    }

    @JsonAnySetter
    public void put(String property, Object value) {
        content.put(property, value);
    }

    public DatastoreValue with(String property, Object value) {
        put(property, value);
        return this;
    }

    @JsonIgnore
    public String key() {
        return keyOf(namespace, id);
    }

    /** @throws ValidationException when namespace or id contain characters outside the allowed set */
    public DatastoreValue validate() {
        requireName("namespace", namespace);
        if (id == null || id.isEmpty()) {
            throw new ValidationException("Datastore value requires an id");
        }
        requireName("id", id);
        return this;
    }

    static String keyOf(String namespace, String id) {
        return namespace == null || namespace.isEmpty() ? id : namespace + ":" + id;
    }

    static String requireName(String what, String value) {
        if (value != null && !NAME_PATTERN.matcher(value).matches()) {
            throw new ValidationException("Invalid " + what + ": '" + value + "'");
        }
        return value == null ? "" : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatastoreValue other)) {
            return false;
        }
        return namespace.equals(other.namespace) && Objects.equals(id, other.id) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, id, content);
    }

    @Override
    public String toString() {
        return "DatastoreValue[" + key() + "]";
    }
}
