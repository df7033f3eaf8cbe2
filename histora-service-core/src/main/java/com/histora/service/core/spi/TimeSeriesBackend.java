package com.histora.service.core.spi;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.query.BackendQuery;
import com.histora.service.core.query.TimeSeriesRow;
import java.time.Instant;
import java.util.List;

/**
 * Durable time-series store. Implementations translate storage failures into
 * {@link com.histora.service.core.error.BackendUnavailableException}.
 */
public interface TimeSeriesBackend {

    /** Writes the batch as one unit. Either every record is stored or the call fails. */
    void write(List<MeasurementRecord> batch);

    /** @return rows ordered by timestamp, then write order. */
    List<TimeSeriesRow> query(BackendQuery query);

    /** @return distinct {@code measurement/field} names written since the given instant, sorted. */
    List<String> listMetrics(Instant since);

    void ping();
}
