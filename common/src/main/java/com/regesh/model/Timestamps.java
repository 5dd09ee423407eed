package com.regesh.model;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Timestamp format shared by enriched records and table entities.
 *
 * <p>Always millisecond precision with an explicit offset, e.g.
 * {@code 2025-06-02T14:03:11.042+02:00}.</p>
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

    private Timestamps() {
        // utility class
    }

    public static String now(Clock clock) {
        return OffsetDateTime.now(clock).format(FORMAT);
    }

    /**
     * Parses any ISO-8601 offset timestamp, not only the ones written by {@link #now(Clock)}.
     */
    public static Optional<OffsetDateTime> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
