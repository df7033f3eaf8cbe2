package com.histora.record.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One immutable measurement: the fields a source reported for a measurement at an instant.
 *
 * <p>Field values are {@code Double}, {@code String} or {@code Boolean}. Other numbers are widened to
 * {@code Double}. The field map is sorted by name and cannot be modified.
 */
public record MeasurementRecord(String source, String measurement, Instant timestamp, Map<String, Object> fields) {

    public static final String METRIC_SEPARATOR = "/";

    public MeasurementRecord {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        if (measurement == null || measurement.isBlank()) {
            throw new IllegalArgumentException("measurement is required");
        }
        Objects.requireNonNull(timestamp, "timestamp");
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("at least one field is required for measurement " + measurement);
        }
        TreeMap<String, Object> copy = new TreeMap<>();
        fields.forEach((name, value) -> copy.put(Objects.requireNonNull(name, "field name"), normalize(name, value)));
        fields = Collections.unmodifiableMap(copy);
    }

    /** Metric name of one field, {@code measurement/field}. */
    public String metricName(String field) {
        return measurement + METRIC_SEPARATOR + field;
    }

    /** Copy of this record carrying only the given subset of fields. */
    public MeasurementRecord withFields(Map<String, Object> subset) {
        return new MeasurementRecord(source, measurement, timestamp, subset);
    }

    private static Object normalize(String name, Object value) {
        if (value instanceof Double || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Unsupported value for field " + name + ": "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
