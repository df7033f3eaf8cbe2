package com.histora.service.core.live;

import com.histora.service.core.error.SinkException;
import com.histora.service.core.query.MetricValue;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * One latest-values subscription. Only the newest snapshot matters, so a snapshot offered while an older one is
 * still waiting replaces it. Pushes run one at a time on the delivery executor.
 */
@Slf4j
public final class MetricsSubscription {

    private final String id;
    private final Set<String> metrics;
    private final MetricsSink sink;
    private final Executor executor;
    private final Consumer<MetricsSubscription> onSinkFailure;

    private final AtomicReference<List<MetricValue>> waiting = new AtomicReference<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    MetricsSubscription(
            String id,
            Set<String> metrics,
            MetricsSink sink,
            Executor executor,
            Consumer<MetricsSubscription> onSinkFailure) {
        this.id = id;
        this.metrics = Set.copyOf(metrics);
        this.sink = sink;
        this.executor = executor;
        this.onSinkFailure = onSinkFailure;
    }

    public String id() {
        return id;
    }

    public Set<String> metrics() {
        return metrics;
    }

    public boolean isClosed() {
        return closed.get();
    }

    void offer(List<MetricValue> snapshot) {
        if (closed.get()) {
            return;
        }
        waiting.set(List.copyOf(snapshot));
        scheduleDrain();
    }

    void close() {
        if (closed.compareAndSet(false, true)) {
            waiting.set(null);
            sink.close();
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            draining.set(false);
            log.debug("Metrics subscription {} delivery rejected, executor is shutting down", id);
        }
    }

    private void drain() {
        try {
            List<MetricValue> snapshot;
            while (!closed.get() && (snapshot = waiting.getAndSet(null)) != null) {
                sink.push(snapshot);
            }
        } catch (SinkException ex) {
            log.info("Metrics subscription {} sink failed: {}", id, ex.getMessage());
            onSinkFailure.accept(this);
            return;
        } finally {
            draining.set(false);
        }
        if (waiting.get() != null && !closed.get()) {
            scheduleDrain();
        }
    }
}
