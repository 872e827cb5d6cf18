package com.tribune.aggregator.util;

import lombok.experimental.UtilityClass;

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
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Permissive date parsing for feed and page dates. Strict ISO-8601 forms are tried first,
 * then a set of lenient English forms. Dates without a zone are taken as UTC.
 */
@UtilityClass
public class DateParsing {

    private static final Pattern MULTI_WS = Pattern.compile("\\s+");

    private static final List<DateTimeFormatter> LENIENT_ZONED = List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            pattern("EEE, d MMM yyyy HH:mm:ss zzz"),
            pattern("EEE, d MMM yyyy HH:mm zzz"),
            pattern("d MMM yyyy HH:mm:ss Z"),
            pattern("d MMM yyyy HH:mm:ss zzz"),
            pattern("MMMM d, yyyy h:mm a z"),
            pattern("yyyy-MM-dd HH:mm:ss Z"),
            pattern("yyyy-MM-dd HH:mm:ssXXX")
    );

    private static final List<DateTimeFormatter> LENIENT_LOCAL_DATE_TIME = List.of(
            pattern("yyyy-MM-dd HH:mm:ss"),
            pattern("yyyy-MM-dd HH:mm"),
            pattern("yyyy/MM/dd HH:mm:ss"),
            pattern("MMMM d, yyyy h:mm a"),
            pattern("MMM d, yyyy h:mm a"),
            pattern("MMMM d, yyyy HH:mm"),
            pattern("MMM d, yyyy HH:mm")
    );

    private static final List<DateTimeFormatter> LENIENT_DATE = List.of(
            pattern("MMMM d, yyyy"),
            pattern("MMM d, yyyy"),
            pattern("d MMMM yyyy"),
            pattern("d MMM yyyy"),
            pattern("EEEE, MMMM d, yyyy"),
            pattern("EEE, MMM d, yyyy"),
            pattern("yyyy/MM/dd"),
            pattern("MM/dd/yyyy")
    );

    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String value = MULTI_WS.matcher(raw.trim()).replaceAll(" ");

        Optional<Instant> strict = parseIso(value);
        if (strict.isPresent()) return strict;
        return parseLenient(value);
    }

    private Optional<Instant> parseIso(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException ignored) {
            // next form
        }
        try {
            return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.ISO_ZONED_DATE_TIME).toInstant());
        } catch (DateTimeParseException ignored) {
            // next form
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException ignored) {
            // next form
        }
        try {
            return Optional.of(LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // next form
        }
        try {
            return Optional.of(LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseLenient(String value) {
        for (DateTimeFormatter f : LENIENT_ZONED) {
            try {
                TemporalAccessor t = f.parse(value);
                return Optional.of(ZonedDateTime.from(t).toInstant());
            } catch (RuntimeException ignored) {
                // try next pattern
            }
        }
        for (DateTimeFormatter f : LENIENT_LOCAL_DATE_TIME) {
            try {
                return Optional.of(LocalDateTime.parse(value, f).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                // try next pattern
            }
        }
        for (DateTimeFormatter f : LENIENT_DATE) {
            try {
                return Optional.of(LocalDate.parse(value, f).atStartOfDay(ZoneOffset.UTC).toInstant());
            } catch (DateTimeParseException ignored) {
                // try next pattern
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
