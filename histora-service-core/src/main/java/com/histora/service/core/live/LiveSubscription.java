package com.histora.service.core.live;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.error.SinkException;
import com.histora.service.core.query.QueryDescriptor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle and delivery state of one live subscriber.
 *
 * <p>Matched batches are queued in an outbox and drained by at most one task at a time, so pushes to this sink
 * are sequential while different subscriptions drain in parallel. A subscription starts held: nothing is drained
 * until {@link #release()}, which lets the historical backfill go out first.
 */
@Slf4j
public final class LiveSubscription {

    private final String id;
    private final String fingerprint;
    private final QueryDescriptor descriptor;
    private final LiveSink sink;
    private final Executor executor;
    private final Consumer<LiveSubscription> onSinkFailure;

    private final Queue<List<MeasurementRecord>> outbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicReference<SubscriptionState> state = new AtomicReference<>(SubscriptionState.OPEN);
    private volatile boolean held = true;
    private volatile Instant cursor;

    LiveSubscription(
            String id,
            QueryDescriptor descriptor,
            LiveSink sink,
            Instant cursor,
            Executor executor,
            Consumer<LiveSubscription> onSinkFailure) {
        this.id = id;
        this.fingerprint = descriptor.fingerprint();
        this.descriptor = descriptor;
        this.sink = sink;
        this.cursor = cursor;
        this.executor = executor;
        this.onSinkFailure = onSinkFailure;
    }

    public String id() {
        return id;
    }

    public String fingerprint() {
        return fingerprint;
    }

    public QueryDescriptor descriptor() {
        return descriptor;
    }

    public SubscriptionState state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == SubscriptionState.OPEN;
    }

    /** Timestamp of the last pushed record, or the lower bound of live delivery before the first push. */
    public Instant cursor() {
        return cursor;
    }

    void pushInitial(List<MeasurementRecord> backfill) throws SinkException {
        sink.push(new LiveUpdate(id, true, backfill));
    }

    void offer(List<MeasurementRecord> matches) {
        if (!isOpen()) {
            return;
        }
        outbox.add(matches);
        scheduleDrain();
    }

    void release() {
        held = false;
        scheduleDrain();
    }

    boolean close() {
        if (!state.compareAndSet(SubscriptionState.OPEN, SubscriptionState.CLOSED)) {
            return false;
        }
        outbox.clear();
        sink.close();
        return true;
    }

    private void scheduleDrain() {
        if (held || !isOpen() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            draining.set(false);
            log.debug("Live delivery for subscription {} rejected, executor is shutting down", id);
        }
    }

    private void drain() {
        try {
            List<MeasurementRecord> batch;
            while (isOpen() && (batch = outbox.poll()) != null) {
                List<MeasurementRecord> fresh = notBeforeCursor(batch);
                if (fresh.isEmpty()) {
                    continue;
                }
                sink.push(new LiveUpdate(id, false, fresh));
                cursor = fresh.get(fresh.size() - 1).timestamp();
            }
        } catch (SinkException | RuntimeException ex) {
            log.info("Live subscription {} sink failed, closing: {}", id, ex.getMessage());
            draining.set(false);
            onSinkFailure.accept(this);
            return;
        }
        draining.set(false);
        if (!outbox.isEmpty()) {
            scheduleDrain();
        }
    }

    private List<MeasurementRecord> notBeforeCursor(List<MeasurementRecord> batch) {
        Instant lowerBound = cursor;
        List<MeasurementRecord> fresh = new ArrayList<>(batch.size());
        for (MeasurementRecord record : batch) {
            if (!record.timestamp().isBefore(lowerBound)) {
                fresh.add(record);
            }
        }
        if (fresh.size() < batch.size()) {
            log.debug(
                    "Live subscription {} skipped {} records older than cursor {}",
                    id,
                    batch.size() - fresh.size(),
                    lowerBound);
        }
        return fresh;
    }

    @Override
    public String toString() {
        return "LiveSubscription{id=" + id + ", fingerprint=" + fingerprint + ", state=" + state.get() + "}";
    }
}
