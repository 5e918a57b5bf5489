package org.carball.widgetq.filter;

import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.error.DateParseException;
import org.carball.widgetq.model.filter.DateRange;
import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.filter.RelativeDateOption;
import org.carball.widgetq.model.filter.ResolvedDate;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DateResolverTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");

    private final DateResolver resolver = DateResolver.utc();

    @Test
    public void shouldResolveToday() {
        DateRange range = resolver.relativeRange("__rel_date:today", NOW);

        assertThat(range.start()).isEqualTo(Instant.parse("2024-03-13T00:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2024-03-13T23:59:59.999Z"));
        assertThat(range.duration()).isEqualTo(Duration.ofDays(1).minusMillis(1));
    }

    @Test
    public void shouldResolveCustomLikeToday() {
        assertThat(resolver.relativeRange(RelativeDateOption.CUSTOM, NOW))
                .isEqualTo(resolver.relativeRange(RelativeDateOption.TODAY, NOW));
    }

    @Test
    public void shouldStartWeeksOnMonday() {
        DateRange thisWeek = resolver.relativeRange(RelativeDateOption.THIS_WEEK, NOW);
        DateRange lastWeek = resolver.relativeRange(RelativeDateOption.LAST_WEEK, NOW);

        assertThat(thisWeek.start()).isEqualTo(Instant.parse("2024-03-11T00:00:00Z"));
        assertThat(thisWeek.end()).isEqualTo(Instant.parse("2024-03-17T23:59:59.999Z"));
        assertThat(lastWeek.start()).isEqualTo(Instant.parse("2024-03-04T00:00:00Z"));
        assertThat(lastWeek.end()).isEqualTo(Instant.parse("2024-03-10T23:59:59.999Z"));
    }

    @Test
    public void shouldIncludeTodayInLastSevenDays() {
        DateRange range = resolver.relativeRange(RelativeDateOption.LAST_7_DAYS, NOW);

        assertThat(range.start()).isEqualTo(Instant.parse("2024-03-07T00:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2024-03-13T23:59:59.999Z"));
    }

    @Test
    public void shouldResolveLastMonthAcrossLeapFebruary() {
        DateRange range = resolver.relativeRange(RelativeDateOption.LAST_MONTH, NOW);

        assertThat(range.start()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2024-02-29T23:59:59.999Z"));
    }

    @Test
    public void shouldResolveLastYear() {
        DateRange range = resolver.relativeRange(RelativeDateOption.LAST_YEAR, NOW);

        assertThat(range.start()).isEqualTo(Instant.parse("2023-01-01T00:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2023-12-31T23:59:59.999Z"));
    }

    @Test
    public void shouldUseConfiguredZoneForCalendarDays() {
        DateResolver newYork = new DateResolver(ZoneId.of("America/New_York"));

        // 02:00 UTC on the 13th is still the 12th in New York
        DateRange range = newYork.relativeRange(RelativeDateOption.TODAY, Instant.parse("2024-03-13T02:00:00Z"));

        assertThat(range.start()).isEqualTo(Instant.parse("2024-03-12T04:00:00Z"));
    }

    @Test
    public void shouldRejectUnknownRelativeOption() {
        assertThatThrownBy(() -> resolver.relativeRange("__rel_date:someday", NOW))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("someday");
    }

    @Test
    public void shouldDetectRelativeTokens() {
        assertThat(DateResolver.isRelativeDate("__rel_date:today")).isTrue();
        assertThat(DateResolver.isRelativeDate("2024-03-13")).isFalse();
        assertThat(DateResolver.isRelativeDate(42)).isFalse();
        assertThat(DateResolver.relativeToken(RelativeDateOption.LAST_30_DAYS)).isEqualTo("__rel_date:last30Days");
    }

    @Test
    public void shouldKeepOwnOffsetForDayRange() {
        DateRange range = resolver.dayRange("2024-03-10T23:30:00-05:00");

        assertThat(range.start()).isEqualTo(Instant.parse("2024-03-10T05:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2024-03-11T04:59:59.999Z"));
    }

    @Test
    public void shouldParsePostgresStyleTimestamps() {
        assertThat(resolver.parseInstant("2024-03-10 12:00:00+00")).isEqualTo(Instant.parse("2024-03-10T12:00:00Z"));
        assertThat(resolver.parseInstant("2024-03-10T12:00:00+0530")).isEqualTo(Instant.parse("2024-03-10T06:30:00Z"));
        assertThat(resolver.parseInstant("2024-03-10T12:00:00")).isEqualTo(Instant.parse("2024-03-10T12:00:00Z"));
    }

    @Test
    public void shouldResolveDateOnlyValueToDayRange() {
        ResolvedDate resolved = resolver.resolve("2024-03-10", NOW);

        assertThat(resolved.isRange()).isTrue();
        assertThat(resolved.lowerBound()).isEqualTo(Instant.parse("2024-03-10T00:00:00Z"));
        assertThat(resolved.upperBound()).isEqualTo(Instant.parse("2024-03-10T23:59:59.999Z"));
    }

    @Test
    public void shouldWidenTimestampToDayForEquality() {
        ResolvedDate exact = resolver.resolve("2024-03-10T15:00:00Z", FilterOperator.GT, NOW);
        ResolvedDate widened = resolver.resolve("2024-03-10T15:00:00Z", FilterOperator.EQ, NOW);

        assertThat(exact.isRange()).isFalse();
        assertThat(exact.instant()).isEqualTo(Instant.parse("2024-03-10T15:00:00Z"));
        assertThat(widened.range()).isEqualTo(resolver.dayRange("2024-03-10"));
    }

    @Test
    public void shouldRejectUnparseableDates() {
        assertThatThrownBy(() -> resolver.parseInstant("not a date"))
                .isInstanceOf(DateParseException.class)
                .hasMessageContaining("not a date");
        assertThatThrownBy(() -> resolver.parseInstant("2024-13-45"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldFormatWithMillisecondsInUtc() {
        assertThat(DateResolver.formatIso(Instant.parse("2024-03-10T05:00:00Z")))
                .isEqualTo("2024-03-10T05:00:00.000Z");
    }
}
