package org.carball.widgetq.trend;

import org.carball.widgetq.error.ValidationException;
import org.carball.widgetq.filter.DateResolver;
import org.carball.widgetq.model.filter.DateRange;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.trend.TrendPeriods;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Reads the comparison period of a metric from its trend filter, the condition tagged
 * {@code config.isTrendFilter = true}.
 */
public class TrendFilterParser {

    private final DateResolver dateResolver;

    public TrendFilterParser(DateResolver dateResolver) {
        this.dateResolver = dateResolver;
    }

    public static boolean isTrendFilter(FilterCondition condition) {
        return condition != null && condition.isTrendFilter();
    }

    public static List<FilterCondition> extractTrendFilters(List<FilterCondition> filters) {
        if (filters == null) {
            return List.of();
        }
        return filters.stream().filter(TrendFilterParser::isTrendFilter).toList();
    }

    public static List<FilterCondition> withoutTrendFilters(List<FilterCondition> filters) {
        if (filters == null) {
            return List.of();
        }
        return filters.stream()
                .filter(Objects::nonNull)
                .filter(f -> !f.isTrendFilter())
                .toList();
    }

    /**
     * Uses the first trend filter. The previous period has the same length and ends where the
     * current one starts.
     */
    public TrendPeriods parse(List<FilterCondition> trendFilters, Instant now) {
        if (trendFilters == null || trendFilters.isEmpty()) {
            throw new ValidationException("trend.filterRequired", "No trend filters provided for trend analysis.");
        }
        FilterCondition trendFilter = trendFilters.get(0);
        if (trendFilter == null || trendFilter.getColumn() == null || trendFilter.getColumn().isBlank()) {
            throw new ValidationException("trend.filterRequired", "No valid trend filter found.");
        }

        DateRange current = parseRange(trendFilter, now);
        Duration length = current.duration();
        DateRange previous = new DateRange(current.start().minus(length), current.start());
        return new TrendPeriods(trendFilter.getColumn(), current, previous);
    }

    public DateRange parseRange(FilterCondition trendFilter, Instant now) {
        if (!(trendFilter.getValue() instanceof String value) || value.isBlank()) {
            throw new ValidationException("trend.invalidValue", List.of("value"),
                    "Trend filter must have a valid string value.", null);
        }

        if (DateResolver.isRelativeDate(value)) {
            return dateResolver.relativeRange(value, now);
        }

        if (value.contains(",")) {
            return parseAbsoluteRange(value);
        }

        throw new ValidationException("trend.invalidValue", List.of("value"),
                "Invalid trend filter date range format: \"" + value
                        + "\". Expected \"__rel_date:option\" or \"start,end\" format.", null);
    }

    private DateRange parseAbsoluteRange(String value) {
        String[] parts = value.split(",", -1);
        String startText = parts[0].trim();
        String endText = parts.length > 1 ? parts[1].trim() : "";
        if (startText.isEmpty() || endText.isEmpty()) {
            throw new ValidationException("trend.invalidValue", List.of("value"),
                    "Invalid date range format. Both start and end dates are required.", null);
        }

        Instant start = dateResolver.parseInstant(startText);
        Instant end = dateResolver.parseInstant(endText);
        if (!start.isBefore(end)) {
            throw new ValidationException("trend.invalidValue", List.of("value"),
                    "Start date must be before end date in trend filter range.", null);
        }
        return new DateRange(start, end);
    }
}
