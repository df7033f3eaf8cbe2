package com.histora.service.core.buffer;

import com.histora.record.model.MeasurementRecord;
import java.time.Instant;
import java.util.List;

/** Published after a batch has been durably written. Records are in enqueue order. */
public record FlushCompletedEvent(long generation, List<MeasurementRecord> records, Instant completedAt) {

    public FlushCompletedEvent {
        records = List.copyOf(records);
    }
}
