package com.histora.service.core.buffer;

import java.time.Instant;

/** Data-loss report: the oldest pending records were dropped to stay within {@code maxPending}. */
public record BufferOverflowEvent(int dropped, int pendingSize, int maxPending, Instant at) {}
