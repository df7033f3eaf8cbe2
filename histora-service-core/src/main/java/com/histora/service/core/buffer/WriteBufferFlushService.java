package com.histora.service.core.buffer;

import com.histora.service.core.spi.TimeSeriesBackend;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains the write buffer into the time-series backend on a fixed cadence, or early when the buffer reports its
 * flush threshold. A failed write is put back into the buffer and retried on the next cycle; early flushes stay
 * suspended until a flush succeeds again. Successful flushes are announced to every {@link FlushListener}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WriteBufferFlushService {

    private final WriteBuffer buffer;
    private final TimeSeriesBackend backend;
    private final List<FlushListener> listeners;
    private final BufferTelemetry telemetry;
    private final Clock clock;

    private final Object flushLock = new Object();
    private final AtomicBoolean earlyFlushRequested = new AtomicBoolean();
    private volatile boolean lastFlushFailed;
    private ExecutorService earlyFlushExecutor;

    @PostConstruct
    void start() {
        earlyFlushExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "histora-early-flush");
            t.setDaemon(true);
            return t;
        });
        buffer.onThresholdReached(this::requestEarlyFlush);
        log.info("Write buffer flush service started listeners={}", listeners.size());
    }

    @PreDestroy
    void stop() {
        if (earlyFlushExecutor != null) {
            earlyFlushExecutor.shutdown();
            try {
                earlyFlushExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        FlushOutcome outcome = flush();
        if (outcome == FlushOutcome.FAILED) {
            log.error("Final flush failed on shutdown; {} pending records are lost", buffer.pendingSize());
        } else {
            log.info("Write buffer drained on shutdown outcome={}", outcome);
        }
    }

    @Scheduled(fixedDelayString = "${histora.buffer.flush.interval-ms:5000}")
    public void flushScheduled() {
        flush();
    }

    /** Non-blocking; coalesces requests while one is outstanding. Ignored after a failed flush. */
    public void requestEarlyFlush() {
        if (earlyFlushExecutor == null || lastFlushFailed || !earlyFlushRequested.compareAndSet(false, true)) {
            return;
        }
        try {
            earlyFlushExecutor.execute(() -> {
                earlyFlushRequested.set(false);
                if (!lastFlushFailed) {
                    flush();
                }
            });
        } catch (RejectedExecutionException ex) {
            earlyFlushRequested.set(false);
            log.debug("Early flush rejected, executor is shutting down");
        }
    }

    public FlushOutcome flush() {
        synchronized (flushLock) {
            FlushedBatch batch = buffer.swap();
            if (batch.isEmpty()) {
                return FlushOutcome.EMPTY;
            }
            Instant started = clock.instant();
            try {
                backend.write(batch.records());
            } catch (Exception ex) {
                lastFlushFailed = true;
                buffer.restore(batch);
                telemetry.recordFlushFailed(batch.generation(), batch.size(), ex);
                log.warn(
                        "Flush of generation {} ({} records) failed, retrying next cycle: {}",
                        batch.generation(),
                        batch.size(),
                        ex.getMessage());
                return FlushOutcome.FAILED;
            }
            lastFlushFailed = false;
            Instant completed = clock.instant();
            telemetry.recordFlushSucceeded(batch.generation(), batch.size(), Duration.between(started, completed));
            log.debug("Flushed generation {} records={}", batch.generation(), batch.size());
            publish(new FlushCompletedEvent(batch.generation(), batch.records(), completed));
            return FlushOutcome.FLUSHED;
        }
    }

    private void publish(FlushCompletedEvent event) {
        for (FlushListener listener : listeners) {
            try {
                listener.onFlushCompleted(event);
            } catch (Exception ex) {
                log.error(
                        "Flush listener {} failed for generation {}",
                        listener.getClass().getSimpleName(),
                        event.generation(),
                        ex);
            }
        }
    }
}
