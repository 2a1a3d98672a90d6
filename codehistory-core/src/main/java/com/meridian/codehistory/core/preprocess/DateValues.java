/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.preprocess;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Day-granularity date coercion for table cells.
 *
 * <p>Accepted shapes: {@link LocalDate}, {@link LocalDateTime}, {@link OffsetDateTime},
 * {@link ZonedDateTime}, {@link Instant} (UTC day), {@link java.util.Date}, and strings in
 * ISO form ({@code 2024-06-10}, {@code 2024-06-10T08:30:00}, {@code 2024-06-10 08:30:00}),
 * compact form ({@code 20240610}) or SAS export form ({@code 10JUN2024},
 * {@code 10JUN2024:08:30:00}). Time of day is discarded.
 */
public final class DateValues {

    private static final Set<String> MISSING = Set.of("", "nat", "nan", "null", "none", "na");

    private static final DateTimeFormatter ISO = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().append(DateTimeFormatter.ISO_LOCAL_TIME).optionalEnd()
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter SAS = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("ddMMMuuuu")
            .optionalStart().appendPattern(":HH:mm:ss").optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private static final List<DateTimeFormatter> FORMATS =
            List.of(ISO, DateTimeFormatter.BASIC_ISO_DATE, SAS);

    private DateValues() {
    }

    /**
     * @return the calendar day of {@code value}, or {@code null} when it is missing or unparseable
     */
    public static LocalDate parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof Instant instant) {
            return LocalDate.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return LocalDate.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        return parseText(value.toString());
    }

    static LocalDate parseText(String raw) {
        String text = raw.trim();
        if (MISSING.contains(text.toLowerCase(Locale.ROOT))) {
            return null;
        }
        for (DateTimeFormatter format : FORMATS) {
            LocalDate parsed = tryParse(text, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static LocalDate tryParse(String text, DateTimeFormatter format) {
        try {
            TemporalAccessor parsed = format.parse(text);
            return LocalDate.from(parsed);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
