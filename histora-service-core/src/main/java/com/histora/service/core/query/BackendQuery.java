package com.histora.service.core.query;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Backend request derived from a validated {@link QueryDescriptor}. A null {@code step} asks for raw points. */
public record BackendQuery(List<String> metrics, Instant start, Instant end, Duration step) {

    public BackendQuery {
        metrics = List.copyOf(metrics);
    }

    static BackendQuery from(QueryDescriptor descriptor) {
        return new BackendQuery(
                List.copyOf(descriptor.metrics()), descriptor.start(), descriptor.end(), descriptor.step());
    }
}
