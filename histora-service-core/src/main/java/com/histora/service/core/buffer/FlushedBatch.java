package com.histora.service.core.buffer;

import com.histora.record.model.MeasurementRecord;
import java.util.List;

/** Contents swapped out of the write buffer for one flush attempt, in enqueue order. */
public record FlushedBatch(long generation, List<MeasurementRecord> records) {

    public FlushedBatch {
        records = List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
