package org.carball.widgetq.filter;

import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.model.filter.FilterCategories;
import org.carball.widgetq.model.filter.FilterCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits filters into WHERE and HAVING sets. Only aggregated widgets get HAVING filters.
 */
@Slf4j
public class FilterCategorizer {

    public static final List<String> DEFAULT_AGGREGATION_ALIASES =
            List.of("value", "count", "total", "avg", "min", "max", "sum");

    private static final Pattern AGGREGATE_FUNCTION =
            Pattern.compile("^(count|sum|avg|min|max)\\s*\\(", Pattern.CASE_INSENSITIVE);

    private final List<String> aggregationAliases;

    public FilterCategorizer() {
        this(DEFAULT_AGGREGATION_ALIASES);
    }

    public FilterCategorizer(List<String> aggregationAliases) {
        this.aggregationAliases = aggregationAliases.stream()
                .map(alias -> alias.toLowerCase(Locale.ROOT))
                .toList();
    }

    public FilterCategories categorize(List<FilterCondition> filters, boolean aggregated) {
        List<FilterCondition> source = filters == null
                ? List.of()
                : filters.stream().filter(Objects::nonNull).toList();
        if (!aggregated) {
            return new FilterCategories(source, List.of());
        }

        List<FilterCondition> where = new ArrayList<>();
        List<FilterCondition> having = new ArrayList<>();
        for (FilterCondition filter : source) {
            if (isAggregationFilter(filter)) {
                having.add(filter);
            } else {
                where.add(filter);
            }
        }
        if (!having.isEmpty()) {
            log.debug("Routed {} filter(s) to HAVING", having.size());
        }
        return new FilterCategories(where, having);
    }

    /**
     * True for configured aliases such as {@code value} and for aggregate calls such as {@code SUM(amount)}.
     */
    boolean isAggregationFilter(FilterCondition filter) {
        if (filter.getColumn() == null) {
            return false;
        }
        String column = filter.getColumn().trim().toLowerCase(Locale.ROOT);

        if (aggregationAliases.contains(column)) {
            return true;
        }
        return AGGREGATE_FUNCTION.matcher(column).find();
    }
}
