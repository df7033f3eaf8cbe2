package com.histora.service.core.query;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Normalized query: metric selectors, a half-open time range {@code [start, end)} where either bound may be
 * open, and an optional downsampling step.
 *
 * <p>A selector is either a measurement name (all of its fields) or a single {@code measurement/field} metric.
 * Construction does not validate; see {@link QueryEngine#validate(QueryDescriptor)}.
 */
public record QueryDescriptor(SortedSet<String> metrics, Instant start, Instant end, Duration step) {

    public QueryDescriptor {
        metrics = metrics == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(metrics));
    }

    public static QueryDescriptor of(Collection<String> metrics, Instant start, Instant end, Duration step) {
        return new QueryDescriptor(metrics == null ? null : new TreeSet<>(metrics), start, end, step);
    }

    public boolean downsampled() {
        return step != null;
    }

    public boolean contains(Instant timestamp) {
        return (start == null || !timestamp.isBefore(start)) && (end == null || timestamp.isBefore(end));
    }

    public QueryDescriptor withRange(Instant newStart, Instant newEnd) {
        return new QueryDescriptor(metrics, newStart, newEnd, step);
    }

    /** Stable hash of the descriptor; equal descriptors share a fingerprint. */
    public String fingerprint() {
        StringBuilder canonical = new StringBuilder();
        canonical.append("metrics=").append(String.join(",", metrics));
        canonical.append("|start=").append(start == null ? "" : start.toString());
        canonical.append("|end=").append(end == null ? "" : end.toString());
        canonical.append("|step=").append(step == null ? "" : step.toString());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
