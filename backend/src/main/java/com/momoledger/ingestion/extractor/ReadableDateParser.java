package com.momoledger.ingestion.extractor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the archive's readable_date attribute (e.g. "10 May 2024 4:30:58 PM"). Values are read as UTC.
 */
public final class ReadableDateParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            caseInsensitive("d MMM yyyy h:mm:ss a"),
            caseInsensitive("d MMM yyyy HH:mm:ss"),
            caseInsensitive("d MMM yyyy HH:mm"),
            SmsFieldExtractor.EMBEDDED_DATE_FORMAT
    );
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            caseInsensitive("d MMM yyyy"),
            caseInsensitive("d MMMM yyyy"),
            DateTimeFormatter.ISO_LOCAL_DATE
    );

    private ReadableDateParser() {
    }

    public static Optional<Instant> parse(String readableDate) {
        if (readableDate == null || readableDate.isBlank()) return Optional.empty();
        String value = readableDate.strip();
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(value, f).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, f).atStartOfDay().toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
