package com.agentguard.api;

import com.agentguard.exception.ValidationException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses the time filters accepted by the log endpoint into UTC local date-times, the
 * form audit timestamps are stored in.
 *
 * <p>Accepts ISO-8601 with an offset or {@code Z} ({@code 2025-01-15T10:00:00Z},
 * {@code 2025-01-15T15:30:00+05:30}) and ISO local date-times, which are read as UTC.
 */
public final class TimestampParser {

    private TimestampParser() {}

    public static LocalDateTime parseUtc(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    field + " must be an ISO-8601 timestamp (e.g. 2025-01-15T10:00:00Z), got: " + value);
        }
    }
}
