package com.histora.service.core.live;

import com.histora.record.model.MeasurementRecord;
import java.util.List;

/**
 * One push to a live subscriber. {@code initial} marks the historical backfill sent before live updates start.
 */
public record LiveUpdate(String subscriptionId, boolean initial, List<MeasurementRecord> records) {

    public LiveUpdate {
        records = List.copyOf(records);
    }
}
