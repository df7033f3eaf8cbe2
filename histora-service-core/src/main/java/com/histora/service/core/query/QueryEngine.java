package com.histora.service.core.query;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.error.ValidationException;
import com.histora.service.core.spi.TimeSeriesBackend;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One-shot historical queries against the time-series backend. Only sees data that has been flushed; never
 * touches the write buffer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryEngine {

    private final TimeSeriesBackend backend;
    private final Clock clock;

    /** @return matching records ordered by timestamp ascending. */
    public List<MeasurementRecord> query(QueryDescriptor descriptor) {
        validate(descriptor);
        BackendQuery backendQuery = BackendQuery.from(descriptor);
        log.debug("Backend query {}", backendQuery);
        List<TimeSeriesRow> rows = backend.query(backendQuery);
        return shape(rows);
    }

    /** @return metric names written within the last {@code window}. */
    public List<String> fields(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new ValidationException("duration must be positive");
        }
        return backend.listMetrics(clock.instant().minus(window));
    }

    public void ping() {
        backend.ping();
    }

    public static void validate(QueryDescriptor descriptor) {
        if (descriptor == null) {
            throw new ValidationException("query descriptor is required");
        }
        if (descriptor.metrics().isEmpty()) {
            throw new ValidationException("at least one metric selector is required");
        }
        for (String metric : descriptor.metrics()) {
            if (metric == null || metric.isBlank()) {
                throw new ValidationException("metric selectors must not be blank");
            }
        }
        if (descriptor.start() != null && descriptor.end() != null && descriptor.start().isAfter(descriptor.end())) {
            throw new ValidationException(
                    "start " + descriptor.start() + " is after end " + descriptor.end());
        }
        if (descriptor.step() != null && (descriptor.step().isNegative() || descriptor.step().isZero())) {
            throw new ValidationException("downsampling step must be positive");
        }
    }

    /**
     * Folds adjacent rows written as one record into a record, then sorts by timestamp. Downsampled buckets fold
     * on source, measurement and bucket start. The sort is stable so records at the same instant keep backend
     * order.
     */
    static List<MeasurementRecord> shape(List<TimeSeriesRow> rows) {
        List<MeasurementRecord> records = new ArrayList<>();
        TimeSeriesRow head = null;
        Map<String, Object> fields = new LinkedHashMap<>();
        for (TimeSeriesRow row : rows) {
            if (row.value() == null) {
                continue;
            }
            if (head != null && !sameRecord(head, row)) {
                records.add(new MeasurementRecord(head.source(), head.measurement(), head.timestamp(), fields));
                fields = new LinkedHashMap<>();
            }
            if (fields.isEmpty()) {
                head = row;
            }
            fields.put(row.field(), row.value());
        }
        if (head != null && !fields.isEmpty()) {
            records.add(new MeasurementRecord(head.source(), head.measurement(), head.timestamp(), fields));
        }
        records.sort(Comparator.comparing(MeasurementRecord::timestamp));
        return records;
    }

    private static boolean sameRecord(TimeSeriesRow a, TimeSeriesRow b) {
        return a.recordId() == b.recordId()
                && a.timestamp().equals(b.timestamp())
                && Objects.equals(a.source(), b.source())
                && Objects.equals(a.measurement(), b.measurement());
    }
}
