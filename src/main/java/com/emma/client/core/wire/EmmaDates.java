package com.emma.client.core.wire;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Coerces the API's timestamp representation ({@code @D:2010-12-13T23:12:44})
 * to and from {@link LocalDateTime}. Entities call this from their parse and
 * extract steps for each of their date attributes.
 */
public final class EmmaDates {

    static final String PREFIX = "@D:";
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private EmmaDates() {
    }

    /**
     * Parses a raw wire value. The {@code @D:} prefix is optional.
     *
     * @param value a wire string, an already resolved {@link LocalDateTime}, or null
     * @return the timestamp, or null for a null or blank value
     * @throws IllegalArgumentException if the value is not a recognizable timestamp
     */
    public static LocalDateTime parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException("Not a timestamp: " + value);
        }
        String trimmed = text.startsWith(PREFIX) ? text.substring(PREFIX.length()) : text;
        if (trimmed.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(trimmed.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a timestamp: " + text, e);
        }
    }

    /**
     * Formats a timestamp in wire form, or returns null for null.
     */
    public static String format(LocalDateTime dateTime) {
        return dateTime != null ? PREFIX + FORMAT.format(dateTime) : null;
    }
}
