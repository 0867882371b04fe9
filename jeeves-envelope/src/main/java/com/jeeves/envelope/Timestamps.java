package com.jeeves.envelope;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * The single textual timestamp format of the persisted state: ISO-8601 in UTC with millisecond
 * precision, e.g. {@code 2024-05-01T10:15:30.123Z}. Timestamps taken by the envelope are truncated
 * to milliseconds so that formatting and parsing is lossless.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    /** Current time truncated to milliseconds. */
    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    public static String format(Instant instant) {
        return instant == null ? null : FORMAT.format(instant);
    }

    /**
     * Parses a timestamp written by {@link #format} or any RFC 3339 timestamp with an offset.
     *
     * @throws EnvelopeStateException when the text is not a timestamp
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return OffsetDateTime.parse(text.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new EnvelopeStateException("Invalid timestamp: " + text, e);
        }
    }
}
