package com.histora.service.core.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.histora.service.core.error.ValidationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationParserTest {

    @Test
    void parsesShorthandUnits() {
        assertThat(DurationParser.parse("500ms")).isEqualTo(Duration.ofMillis(500));
        assertThat(DurationParser.parse("10s")).isEqualTo(Duration.ofSeconds(10));
        assertThat(DurationParser.parse("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(DurationParser.parse("1H")).isEqualTo(Duration.ofHours(1));
        assertThat(DurationParser.parse("2d")).isEqualTo(Duration.ofDays(2));
        assertThat(DurationParser.parse("1w")).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void parsesIsoAndBareSeconds() {
        assertThat(DurationParser.parse("PT10S")).isEqualTo(Duration.ofSeconds(10));
        assertThat(DurationParser.parse("5")).isEqualTo(Duration.ofSeconds(5));
        assertThat(DurationParser.parse("1.5")).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> DurationParser.parse("")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DurationParser.parse("ten seconds")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DurationParser.parse("5y")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DurationParser.parse("PXS")).isInstanceOf(ValidationException.class);
    }
}
