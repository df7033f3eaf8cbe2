package com.histora.service.core.support;

import com.histora.service.core.error.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Parses timestamps given as ISO-8601 text or as epoch numbers. Numbers above {@code 10e10} are taken as
 * milliseconds (that is 1973 in ms, but year 5138 in seconds), smaller ones as seconds. Sub-millisecond
 * fractions are truncated; epochs beyond the range of epoch milliseconds are rejected.
 */
public final class InstantParser {

    private static final BigDecimal MILLIS_THRESHOLD = new BigDecimal("10e10");

    private InstantParser() {}

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (isNumeric(trimmed)) {
            return fromEpoch(new BigDecimal(trimmed));
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // offsets other than Z
        }
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid timestamp: " + value, ex);
        }
    }

    public static Instant fromEpoch(Number value) {
        BigDecimal epoch = value instanceof BigDecimal bd ? bd : new BigDecimal(value.toString());
        BigDecimal millis = epoch.compareTo(MILLIS_THRESHOLD) > 0 ? epoch : epoch.movePointRight(3);
        try {
            return Instant.ofEpochMilli(millis.setScale(0, RoundingMode.FLOOR).longValueExact());
        } catch (ArithmeticException ex) {
            throw new ValidationException("Timestamp out of range: " + value, ex);
        }
    }

    private static boolean isNumeric(String value) {
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }
}
