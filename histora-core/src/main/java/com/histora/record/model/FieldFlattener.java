package com.histora.record.model;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flattens nested payload data into a single level map. Nested keys become {@code /}-separated paths and list
 * elements are keyed by their index.
 *
 * <pre>
 * {"block1": {"values": {"temp": 20.5}, "ids": [3, 4]}}
 *   -> {"block1/ids/0": 3, "block1/ids/1": 4, "block1/values/temp": 20.5}
 * </pre>
 *
 * Null leaves are skipped.
 */
public final class FieldFlattener {

    private FieldFlattener() {}

    public static Map<String, Object> flatten(Map<?, ?> data) {
        TreeMap<String, Object> out = new TreeMap<>();
        flattenInto(out, "", data);
        return out;
    }

    private static void flattenInto(Map<String, Object> out, String prefix, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> flattenInto(out, path(prefix, String.valueOf(k)), v));
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                flattenInto(out, path(prefix, Integer.toString(i)), list.get(i));
            }
        } else {
            out.put(prefix, value);
        }
    }

    private static String path(String prefix, String key) {
        return prefix.isEmpty() ? key : prefix + MeasurementRecord.METRIC_SEPARATOR + key;
    }
}
