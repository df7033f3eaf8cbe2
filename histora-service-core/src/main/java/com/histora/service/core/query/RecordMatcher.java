package com.histora.service.core.query;

import com.histora.record.model.MeasurementRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a descriptor's selectors and time range to in-memory records. Shares its selector semantics with the
 * backend query so historical and live results agree.
 */
public final class RecordMatcher {

    private RecordMatcher() {}

    /**
     * @return the record reduced to its selected fields, or empty when it is out of range or nothing is selected.
     */
    public static Optional<MeasurementRecord> match(QueryDescriptor descriptor, MeasurementRecord record) {
        if (!descriptor.contains(record.timestamp())) {
            return Optional.empty();
        }
        if (descriptor.metrics().contains(record.measurement())) {
            return Optional.of(record);
        }
        Map<String, Object> selected = new LinkedHashMap<>();
        record.fields().forEach((field, value) -> {
            if (descriptor.metrics().contains(record.metricName(field))) {
                selected.put(field, value);
            }
        });
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(selected.size() == record.fields().size() ? record : record.withFields(selected));
    }

    /** Matching records in timestamp order; equal timestamps keep their input order. */
    public static List<MeasurementRecord> select(QueryDescriptor descriptor, List<MeasurementRecord> records) {
        List<MeasurementRecord> matches = new ArrayList<>();
        for (MeasurementRecord record : records) {
            match(descriptor, record).ifPresent(matches::add);
        }
        matches.sort(Comparator.comparing(MeasurementRecord::timestamp));
        return matches;
    }
}
