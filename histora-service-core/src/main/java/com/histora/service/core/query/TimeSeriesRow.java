package com.histora.service.core.query;

import java.time.Instant;

/**
 * One stored field value, or one downsampled bucket when the query had a step. Rows sharing a non-zero
 * {@code recordId} were written as one record; buckets carry {@link #BUCKET}.
 */
public record TimeSeriesRow(
        long recordId, String source, String measurement, String field, Instant timestamp, Object value) {

    public static final long BUCKET = 0L;
}
