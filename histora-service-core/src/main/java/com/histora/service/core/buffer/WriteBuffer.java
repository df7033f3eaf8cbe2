package com.histora.service.core.buffer;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.config.HistoraProperties;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Accepts records from producers and hands them out in batches for flushing.
 *
 * <p>Producers share the read side of {@link #swapLock}, so concurrent enqueues never wait on each other. The
 * write side is held only while the pending batch pointer is replaced ({@link #swap()}) or a failed batch is put
 * back in front of it ({@link #restore(FlushedBatch)}); no backend I/O happens under the lock.
 *
 * <p>Records are always accepted. When more than {@code maxPending} records are waiting, the oldest are dropped
 * and reported to {@link BufferTelemetry}.
 */
@Component
@Slf4j
public class WriteBuffer {

    private final ReadWriteLock swapLock = new ReentrantReadWriteLock();
    private final BufferTelemetry telemetry;
    private final Clock clock;
    private final int maxPending;
    private final int flushThreshold;

    private volatile PendingBatch pending = new PendingBatch(1);
    private volatile Runnable thresholdListener = () -> {};

    @Autowired
    public WriteBuffer(HistoraProperties properties, BufferTelemetry telemetry, Clock clock) {
        this(properties.getBuffer().getMaxPending(), properties.getBuffer().getFlush().getThreshold(), telemetry, clock);
    }

    public WriteBuffer(int maxPending, int flushThreshold, BufferTelemetry telemetry, Clock clock) {
        if (maxPending <= 0) {
            throw new IllegalArgumentException("maxPending must be positive");
        }
        this.maxPending = maxPending;
        this.flushThreshold = flushThreshold;
        this.telemetry = telemetry;
        this.clock = clock;
        log.info("Write buffer ready maxPending={} flushThreshold={}", maxPending, flushThreshold);
    }

    /** Called (on the enqueuing thread) whenever the pending size reaches the flush threshold. */
    public void onThresholdReached(Runnable listener) {
        this.thresholdListener = Objects.requireNonNull(listener, "listener");
    }

    public void enqueue(MeasurementRecord record) {
        Objects.requireNonNull(record, "record");
        int size;
        int dropped = 0;
        swapLock.readLock().lock();
        try {
            size = pending.append(record);
            if (size > maxPending) {
                dropped = pending.dropOldest(maxPending);
            }
        } finally {
            swapLock.readLock().unlock();
        }
        telemetry.recordEnqueued(1);
        if (dropped > 0) {
            telemetry.recordOverflow(new BufferOverflowEvent(dropped, maxPending, maxPending, clock.instant()));
        }
        if (flushThreshold > 0 && size >= flushThreshold) {
            thresholdListener.run();
        }
    }

    public void enqueueAll(List<MeasurementRecord> records) {
        for (MeasurementRecord record : records) {
            enqueue(record);
        }
    }

    /** Replaces the pending batch with an empty one and returns what was accumulated. */
    public FlushedBatch swap() {
        PendingBatch taken;
        swapLock.writeLock().lock();
        try {
            taken = pending;
            pending = new PendingBatch(taken.generation() + 1);
        } finally {
            swapLock.writeLock().unlock();
        }
        return new FlushedBatch(taken.generation(), taken.contents());
    }

    /**
     * Puts a batch whose flush failed back in front of everything enqueued since it was swapped out, preserving
     * the original order.
     */
    public void restore(FlushedBatch failed) {
        if (failed.isEmpty()) {
            return;
        }
        List<MeasurementRecord> restored = failed.records();
        if (restored.size() > maxPending) {
            restored = restored.subList(restored.size() - maxPending, restored.size());
        }
        int trimmed = failed.size() - restored.size();
        ConcurrentLinkedQueue<MeasurementRecord> head = PendingBatch.headOf(restored);
        int dropped;
        int size;
        swapLock.writeLock().lock();
        try {
            PendingBatch merged = pending.prepend(head, restored.size());
            dropped = trimmed + merged.dropOldest(maxPending);
            size = merged.size();
            pending = merged;
        } finally {
            swapLock.writeLock().unlock();
        }
        log.debug("Restored {} records of failed generation {} (pending={})", failed.size(), failed.generation(), size);
        if (dropped > 0) {
            telemetry.recordOverflow(new BufferOverflowEvent(dropped, size, maxPending, clock.instant()));
        }
    }

    public int pendingSize() {
        return pending.size();
    }

    public long currentGeneration() {
        return pending.generation();
    }

    public int maxPending() {
        return maxPending;
    }
}
