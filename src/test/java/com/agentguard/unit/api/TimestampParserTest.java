package com.agentguard.unit.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.agentguard.api.TimestampParser;
import com.agentguard.exception.ValidationException;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TimestampParserTest {

    @Test
    @DisplayName("Z suffix is read as UTC")
    void utcSuffix() {
        assertThat(TimestampParser.parseUtc("2025-01-15T10:00:00Z", "start_time"))
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 10, 0));
    }

    @Test
    @DisplayName("explicit offsets are normalized to UTC")
    void offsetNormalized() {
        assertThat(TimestampParser.parseUtc("2025-01-15T15:30:00+05:30", "start_time"))
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 10, 0));
    }

    @Test
    @DisplayName("local date-time is taken as UTC")
    void localIsUtc() {
        assertThat(TimestampParser.parseUtc("2025-01-15T10:00:00", "end_time"))
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 10, 0));
    }

    @Test
    @DisplayName("absent value means no bound")
    void absent() {
        assertThat(TimestampParser.parseUtc(null, "start_time")).isNull();
        assertThat(TimestampParser.parseUtc("", "start_time")).isNull();
    }

    @Test
    @DisplayName("anything else is a validation error naming the field")
    void invalid() {
        assertThatThrownBy(() -> TimestampParser.parseUtc("yesterday", "start_time"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("start_time");
        assertThatThrownBy(() -> TimestampParser.parseUtc("2025-01-15", "end_time"))
                .isInstanceOf(ValidationException.class);
    }
}
