package com.histora.service.core.query;

import com.histora.service.core.error.ValidationException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Time column format of a CSV export. */
public enum CsvPrecision {
    NS("ns"),
    MS("ms"),
    S("s"),
    ISO8601("ISO8601");

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final String label;

    CsvPrecision(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String format(Instant time) {
        return switch (this) {
            case NS -> Long.toString(
                    Math.addExact(Math.multiplyExact(time.getEpochSecond(), 1_000_000_000L), time.getNano()));
            case MS -> Long.toString(time.toEpochMilli());
            case S -> Long.toString(time.getEpochSecond());
            case ISO8601 -> ISO_MILLIS.format(time);
        };
    }

    public static CsvPrecision parse(String value) {
        if (value == null || value.isBlank()) {
            return ISO8601;
        }
        for (CsvPrecision precision : values()) {
            if (precision.label.equalsIgnoreCase(value.trim())) {
                return precision;
            }
        }
        throw new ValidationException("precision must be one of ns, ms, s, ISO8601, got " + value);
    }
}
