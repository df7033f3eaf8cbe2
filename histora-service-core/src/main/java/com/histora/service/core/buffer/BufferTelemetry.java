package com.histora.service.core.buffer;

import java.time.Duration;

public interface BufferTelemetry {
    void recordEnqueued(int count);

    void recordOverflow(BufferOverflowEvent event);

    void recordFlushSucceeded(long generation, int records, Duration elapsed);

    void recordFlushFailed(long generation, int records, Exception cause);
}
