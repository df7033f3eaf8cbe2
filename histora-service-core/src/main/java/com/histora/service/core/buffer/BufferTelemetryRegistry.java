package com.histora.service.core.buffer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
@Slf4j
public class BufferTelemetryRegistry implements BufferTelemetry {
    private final LongAdder enqueued = new LongAdder();
    private final LongAdder flushed = new LongAdder();
    private final LongAdder flushes = new LongAdder();
    private final LongAdder flushFailures = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final LongAdder overflowEvents = new LongAdder();
    private final AtomicReference<BufferOverflowEvent> lastOverflow = new AtomicReference<>();

    @Override
    public void recordEnqueued(int count) {
        enqueued.add(count);
    }

    @Override
    public void recordOverflow(BufferOverflowEvent event) {
        overflowEvents.increment();
        dropped.add(event.dropped());
        lastOverflow.set(event);
        log.warn(
                "Write buffer overflow: dropped {} oldest records (pending={}, maxPending={}). Data lost.",
                event.dropped(),
                event.pendingSize(),
                event.maxPending());
    }

    @Override
    public void recordFlushSucceeded(long generation, int records, Duration elapsed) {
        flushes.increment();
        flushed.add(records);
    }

    @Override
    public void recordFlushFailed(long generation, int records, Exception cause) {
        flushFailures.increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                enqueued.sum(),
                flushed.sum(),
                flushes.sum(),
                flushFailures.sum(),
                dropped.sum(),
                overflowEvents.sum(),
                lastOverflow.get());
    }

    public record Snapshot(
            long enqueued,
            long flushed,
            long flushes,
            long flushFailures,
            long dropped,
            long overflowEvents,
            BufferOverflowEvent lastOverflow) {}
}
