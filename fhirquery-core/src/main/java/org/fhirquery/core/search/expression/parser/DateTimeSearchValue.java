package org.fhirquery.core.search.expression.parser;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * A date search value with the instant range implied by its precision,
 * e.g. {@code 2024-03} covers the whole of March 2024 (UTC).
 */
record DateTimeSearchValue(Instant start, Instant end) {

    /**
     * Parses a FHIR date, partial date or dateTime. A dateTime without offset is taken as UTC.
     *
     * @throws IllegalArgumentException if the value is not a valid date
     */
    static DateTimeSearchValue parse(String value) {
        try {
            if (value.indexOf('T') > 0) {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                        .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
                Instant instant = parsed instanceof OffsetDateTime offsetDateTime
                        ? offsetDateTime.toInstant()
                        : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
                return new DateTimeSearchValue(instant, instant);
            }

            return switch (value.length()) {
                case 4 -> {
                    Year year = Year.parse(value);
                    yield ofDays(year.atDay(1), year.atMonth(Month.DECEMBER).atEndOfMonth());
                }
                case 7 -> {
                    YearMonth yearMonth = YearMonth.parse(value);
                    yield ofDays(yearMonth.atDay(1), yearMonth.atEndOfMonth());
                }
                default -> {
                    LocalDate date = LocalDate.parse(value);
                    yield ofDays(date, date);
                }
            };
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'" + value + "' is not a valid date", e);
        }
    }

    private static DateTimeSearchValue ofDays(LocalDate first, LocalDate last) {
        Instant start = first.atStartOfDay().toInstant(ZoneOffset.UTC);
        Instant end = last.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1);
        return new DateTimeSearchValue(start, end);
    }
}
