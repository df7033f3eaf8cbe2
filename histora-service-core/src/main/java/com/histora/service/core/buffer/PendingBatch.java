package com.histora.service.core.buffer;

import com.histora.record.model.MeasurementRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accumulator for records awaiting flush. Appends are lock-free; {@link #size()} never exceeds the number of
 * queued records because the counter is raised only after the append and lowered before a removal.
 *
 * <p>A restored batch keeps the failed records in a separate {@code head} queue in front of the appended ones,
 * so putting a batch back never copies what producers added in the meantime.
 */
final class PendingBatch {

    private final long generation;
    private final ConcurrentLinkedQueue<MeasurementRecord> head;
    private final ConcurrentLinkedQueue<MeasurementRecord> records;
    private final AtomicInteger size;

    PendingBatch(long generation) {
        this(generation, new ConcurrentLinkedQueue<>(), new ConcurrentLinkedQueue<>(), 0);
    }

    private PendingBatch(
            long generation,
            ConcurrentLinkedQueue<MeasurementRecord> head,
            ConcurrentLinkedQueue<MeasurementRecord> records,
            int size) {
        this.generation = generation;
        this.head = head;
        this.records = records;
        this.size = new AtomicInteger(size);
    }

    /** Builds the queue for {@link #prepend}; call it outside any lock. */
    static ConcurrentLinkedQueue<MeasurementRecord> headOf(Collection<MeasurementRecord> restored) {
        return new ConcurrentLinkedQueue<>(restored);
    }

    /**
     * Returns a batch of the same generation with {@code restored} in front. Shares this batch's appended
     * records, so it must only be called while no producer can append here.
     */
    PendingBatch prepend(ConcurrentLinkedQueue<MeasurementRecord> restored, int restoredSize) {
        if (!head.isEmpty()) {
            restored.addAll(head);
        }
        return new PendingBatch(generation, restored, records, restoredSize + size.get());
    }

    long generation() {
        return generation;
    }

    int append(MeasurementRecord record) {
        records.add(record);
        return size.incrementAndGet();
    }

    int size() {
        return size.get();
    }

    /** Removes the oldest records until at most {@code max} remain. @return number removed. */
    int dropOldest(int max) {
        int dropped = 0;
        while (true) {
            int current = size.get();
            if (current <= max) {
                return dropped;
            }
            if (size.compareAndSet(current, current - 1)) {
                if (head.poll() == null) {
                    records.poll();
                }
                dropped++;
            }
        }
    }

    /** Only valid once no appender can reach this batch any more. */
    List<MeasurementRecord> contents() {
        List<MeasurementRecord> all = new ArrayList<>(size.get());
        all.addAll(head);
        all.addAll(records);
        return all;
    }
}
