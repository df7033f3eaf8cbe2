package com.histora.service.core.query;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.buffer.FlushCompletedEvent;
import com.histora.service.core.buffer.FlushListener;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Latest flushed value of every numeric or boolean metric. Booleans are cached as 1 and 0. Update listeners get
 * the names of the metrics whose cached value changed in a flush.
 */
@Slf4j
@Component
public class MetricsCache implements FlushListener {

    private final ConcurrentMap<String, MetricValue> latest = new ConcurrentHashMap<>();
    private final List<Consumer<Set<String>>> updateListeners = new CopyOnWriteArrayList<>();

    public void onUpdate(Consumer<Set<String>> listener) {
        updateListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void onFlushCompleted(FlushCompletedEvent event) {
        Set<String> updated = new TreeSet<>();
        for (MeasurementRecord record : event.records()) {
            record.fields().forEach((field, value) -> {
                Double numeric = toNumber(value);
                if (numeric == null) {
                    return;
                }
                MetricValue candidate = new MetricValue(record.metricName(field), numeric, record.timestamp());
                MetricValue kept = latest.merge(candidate.metric(), candidate, (current, incoming) ->
                        incoming.timestamp().isBefore(current.timestamp()) ? current : incoming);
                if (kept == candidate) {
                    updated.add(candidate.metric());
                }
            });
        }
        if (updated.isEmpty()) {
            return;
        }
        Set<String> names = Set.copyOf(updated);
        for (Consumer<Set<String>> listener : updateListeners) {
            try {
                listener.accept(names);
            } catch (RuntimeException ex) {
                log.error("Metrics update listener failed for {} metrics", names.size(), ex);
            }
        }
    }

    /** @return cached values for the requested metrics, in request order, skipping unknown ones. */
    public List<MetricValue> metrics(Collection<String> metrics) {
        List<MetricValue> out = new ArrayList<>();
        for (String metric : metrics) {
            MetricValue value = latest.get(metric);
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    private static Double toNumber(Object value) {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return null;
    }
}
