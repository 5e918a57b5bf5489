package org.carball.widgetq.trend;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.filter.DateResolver;
import org.carball.widgetq.model.filter.DateRange;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.trend.TrendPeriods;
import org.carball.widgetq.model.trend.TrendQueryPlan;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.Pagination;
import org.carball.widgetq.model.widget.QueryParams;
import org.carball.widgetq.model.widget.WidgetDescriptor;
import org.carball.widgetq.model.widget.WidgetType;
import org.carball.widgetq.query.QueryParamsBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the current-period and previous-period queries for a metric with a trend filter.
 */
@Slf4j
@RequiredArgsConstructor
public class MetricTrendPlanner {

    private final QueryParamsBuilder queryParamsBuilder;
    private final TrendFilterParser trendFilterParser;

    public TrendQueryPlan plan(WidgetDescriptor widget, MetricConfig config, Pagination pagination,
                               List<ColumnMeta> columns, Instant now) {
        if (widget.getWidgetType() != WidgetType.METRIC) {
            throw new ConfigException("Trends are only available for metric widgets");
        }

        List<FilterCondition> filters = config.getFilters() == null ? List.of() : config.getFilters();
        TrendPeriods periods = trendFilterParser.parse(TrendFilterParser.extractTrendFilters(filters), now);
        List<FilterCondition> regular = TrendFilterParser.withoutTrendFilters(filters);

        QueryParams current = queryParamsBuilder.build(widget,
                withPeriod(config, regular, periods.column(), periods.current()), pagination, columns, now);
        QueryParams previous = queryParamsBuilder.build(widget,
                withPeriod(config, regular, periods.column(), periods.previous()), pagination, columns, now);

        log.debug("Planned trend on '{}': current {} - {}, previous {} - {}", periods.column(),
                periods.current().start(), periods.current().end(),
                periods.previous().start(), periods.previous().end());
        return new TrendQueryPlan(current, previous, periods);
    }

    private static MetricConfig withPeriod(MetricConfig config, List<FilterCondition> regular,
                                           String column, DateRange period) {
        List<FilterCondition> filters = new ArrayList<>(regular);
        filters.add(FilterCondition.builder()
                .column(column)
                .operator(FilterOperator.BETWEEN)
                .value(DateResolver.formatIso(period.start()) + "," + DateResolver.formatIso(period.end()))
                .build());
        return config.toBuilder().filters(filters).build();
    }
}
