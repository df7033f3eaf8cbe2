package com.histora.service.core.support;

import com.histora.service.core.error.ValidationException;
import java.time.Duration;
import java.util.Locale;

/** Parses shorthand durations such as "500ms", "10s", "5m", "1h", "1d", "1w" as well as ISO-8601 "PT10S". */
public final class DurationParser {

    private DurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new ValidationException("Duration cannot be null or empty");
        }

        String trimmed = input.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                return Duration.parse(trimmed);
            } catch (RuntimeException ex) {
                throw new ValidationException("Unsupported duration format: " + input, ex);
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (Character.isDigit(lower.charAt(lower.length() - 1))) {
            // bare number of seconds
            try {
                return Duration.ofMillis(Math.round(Double.parseDouble(lower) * 1000));
            } catch (NumberFormatException ex) {
                throw new ValidationException("Unsupported duration format: " + input, ex);
            }
        }
        try {
            if (lower.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(lower.substring(0, lower.length() - 2)));
            }
            long value = Long.parseLong(lower.substring(0, lower.length() - 1));
            switch (lower.charAt(lower.length() - 1)) {
                case 's':
                    return Duration.ofSeconds(value);
                case 'm':
                    return Duration.ofMinutes(value);
                case 'h':
                    return Duration.ofHours(value);
                case 'd':
                    return Duration.ofDays(value);
                case 'w':
                    return Duration.ofDays(value * 7);
                default:
                    break;
            }
        } catch (NumberFormatException ex) {
            throw new ValidationException("Unsupported duration format: " + input, ex);
        }
        throw new ValidationException("Unsupported duration format: " + input);
    }
}
