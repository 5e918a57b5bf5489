package org.carball.widgetq.filter;

import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.error.DateParseException;
import org.carball.widgetq.model.filter.DateRange;
import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.filter.RelativeDateOption;
import org.carball.widgetq.model.filter.ResolvedDate;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves relative-date tokens and absolute date strings into instants and calendar ranges.
 * Calendar arithmetic happens in the configured zone; {@code now} is always passed in.
 */
public class DateResolver {

    public static final String RELATIVE_PREFIX = "__rel_date:";

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:.*)$");

    // Postgres renders offsets as +00 or +0530
    private static final Pattern SHORT_OFFSET =
            Pattern.compile("^(.*T\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?)([+-]\\d{2})(\\d{2})?$");

    private final ZoneId zone;

    public DateResolver(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static DateResolver utc() {
        return new DateResolver(ZoneOffset.UTC);
    }

    public ZoneId getZone() {
        return zone;
    }

    public static boolean isRelativeDate(Object value) {
        return value instanceof String s && s.startsWith(RELATIVE_PREFIX);
    }

    public static String relativeToken(RelativeDateOption option) {
        return RELATIVE_PREFIX + option.getKey();
    }

    public RelativeDateOption extractOption(String value) {
        if (!isRelativeDate(value)) {
            throw new ConfigException("Not a relative date token: " + value);
        }
        String name = value.substring(RELATIVE_PREFIX.length());
        return RelativeDateOption.fromKey(name)
                .orElseThrow(() -> new ConfigException("Unknown relative date option: " + name));
    }

    public DateRange relativeRange(String token, Instant now) {
        return relativeRange(extractOption(token), now);
    }

    public DateRange relativeRange(RelativeDateOption option, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));

        return switch (option) {
            case TODAY, CUSTOM -> days(today, today);
            case YESTERDAY -> days(today.minusDays(1), today.minusDays(1));
            case TOMORROW -> days(today.plusDays(1), today.plusDays(1));
            case THIS_WEEK -> days(monday, monday.plusDays(6));
            case LAST_WEEK -> days(monday.minusWeeks(1), monday.minusDays(1));
            case NEXT_WEEK -> days(monday.plusWeeks(1), monday.plusDays(13));
            case THIS_MONTH -> month(today);
            case LAST_MONTH -> month(today.minusMonths(1));
            case NEXT_MONTH -> month(today.plusMonths(1));
            case LAST_7_DAYS -> days(today.minusDays(6), today);
            case NEXT_7_DAYS -> days(today, today.plusDays(6));
            case LAST_30_DAYS -> days(today.minusDays(29), today);
            case NEXT_30_DAYS -> days(today, today.plusDays(29));
            case THIS_YEAR -> year(today);
            case LAST_YEAR -> year(today.minusYears(1));
        };
    }

    /**
     * Parses an absolute date. A date-only value is the start of that day in the configured zone,
     * a timestamp without offset is read in the configured zone.
     */
    public Instant parseInstant(String value) {
        ParsedDate parsed = parse(value);
        return parsed.dateTime().atZone(parsed.zone()).toInstant();
    }

    /**
     * The calendar day named by the value's own wall-clock date, from 00:00:00.000 to 23:59:59.999.
     * An explicit offset in the value is kept, so {@code 2024-03-10T23:30:00-05:00} stays on March 10th.
     */
    public DateRange dayRange(String value) {
        ParsedDate parsed = parse(value);
        LocalDate day = parsed.dateTime().toLocalDate();
        return days(day, day, parsed.zone());
    }

    public ResolvedDate resolve(String value, Instant now) {
        if (isRelativeDate(value)) {
            return ResolvedDate.of(relativeRange(value, now));
        }
        ParsedDate parsed = parse(value);
        if (parsed.dateOnly()) {
            LocalDate day = parsed.dateTime().toLocalDate();
            return ResolvedDate.of(days(day, day, parsed.zone()));
        }
        return ResolvedDate.of(parsed.dateTime().atZone(parsed.zone()).toInstant());
    }

    /**
     * Like {@link #resolve(String, Instant)}, but equality widens absolute values to the whole day.
     */
    public ResolvedDate resolve(String value, FilterOperator operator, Instant now) {
        if (isRelativeDate(value)) {
            return ResolvedDate.of(relativeRange(value, now));
        }
        if (operator == FilterOperator.EQ || operator == FilterOperator.NEQ
                || operator == FilterOperator.DURING) {
            return ResolvedDate.of(dayRange(value));
        }
        return resolve(value, now);
    }

    public static String formatIso(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    public static boolean isDateOnly(String value) {
        return value != null && DATE_ONLY.matcher(value.trim()).matches();
    }

    private ParsedDate parse(String value) {
        if (value == null || value.isBlank()) {
            throw new DateParseException(String.valueOf(value));
        }
        String trimmed = value.trim();

        if (DATE_ONLY.matcher(trimmed).matches()) {
            try {
                return new ParsedDate(LocalDate.parse(trimmed).atStartOfDay(), zone, true);
            } catch (DateTimeParseException e) {
                throw new DateParseException(value, e);
            }
        }

        String normalized = normalizeTimestamp(trimmed);
        try {
            OffsetDateTime offsetDateTime = OffsetDateTime.parse(normalized);
            return new ParsedDate(offsetDateTime.toLocalDateTime(), offsetDateTime.getOffset(), false);
        } catch (DateTimeParseException e) {
            try {
                return new ParsedDate(LocalDateTime.parse(normalized), zone, false);
            } catch (DateTimeParseException inner) {
                throw new DateParseException(value, inner);
            }
        }
    }

    private static String normalizeTimestamp(String value) {
        String result = value;
        Matcher spaced = SPACE_SEPARATED.matcher(result);
        if (spaced.matches()) {
            result = spaced.group(1) + "T" + spaced.group(2);
        }
        Matcher offset = SHORT_OFFSET.matcher(result);
        if (offset.matches()) {
            String minutes = offset.group(3) == null ? "00" : offset.group(3);
            result = offset.group(1) + offset.group(2) + ":" + minutes;
        }
        return result;
    }

    private DateRange month(LocalDate anyDay) {
        return days(anyDay.withDayOfMonth(1), anyDay.with(TemporalAdjusters.lastDayOfMonth()));
    }

    private DateRange year(LocalDate anyDay) {
        return days(anyDay.withDayOfYear(1), anyDay.with(TemporalAdjusters.lastDayOfYear()));
    }

    private DateRange days(LocalDate first, LocalDate last) {
        return days(first, last, zone);
    }

    private static DateRange days(LocalDate first, LocalDate last, ZoneId zoneId) {
        Instant start = first.atStartOfDay(zoneId).toInstant();
        Instant end = last.plusDays(1).atStartOfDay(zoneId).toInstant().minusMillis(1);
        return new DateRange(start, end);
    }

    private record ParsedDate(LocalDateTime dateTime, ZoneId zone, boolean dateOnly) {
    }
}
