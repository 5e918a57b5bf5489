package org.carball.widgetq.query;

import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.filter.FilterCategorizer;
import org.carball.widgetq.filter.FilterCompiler;
import org.carball.widgetq.model.filter.CompiledPredicate;
import org.carball.widgetq.model.filter.FilterCategories;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.widget.AggregationType;
import org.carball.widgetq.model.widget.ChartConfig;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.MultiSeriesConfig;
import org.carball.widgetq.model.widget.Pagination;
import org.carball.widgetq.model.widget.QueryParams;
import org.carball.widgetq.model.widget.TableConfig;
import org.carball.widgetq.model.widget.WidgetDescriptor;
import org.carball.widgetq.model.widget.WidgetQueryConfig;
import org.carball.widgetq.model.widget.WidgetType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles widget-type-specific query parameters. Keys that do not apply to a widget type are
 * never emitted, so consumers can rely on key absence.
 */
@Slf4j
public class QueryParamsBuilder {

    private static final String WILDCARD = "*";

    private final FilterCompiler filterCompiler;
    private final FilterCategorizer filterCategorizer;
    private final int defaultPage;
    private final int defaultPageSize;

    public QueryParamsBuilder(FilterCompiler filterCompiler, FilterCategorizer filterCategorizer,
                              int defaultPage, int defaultPageSize) {
        this.filterCompiler = filterCompiler;
        this.filterCategorizer = filterCategorizer;
        this.defaultPage = defaultPage;
        this.defaultPageSize = defaultPageSize;
    }

    public QueryParams build(WidgetDescriptor widget, WidgetQueryConfig config, Pagination pagination,
                             List<ColumnMeta> columns, Instant now) {
        String schemaName = requireText(widget == null ? null : widget.getSchemaName(), "schemaName");
        String tableName = requireText(widget.getTableName(), "tableName");
        WidgetType type = widget.getWidgetType();
        if (type == null) {
            throw new ConfigException("Widget type is required");
        }

        WidgetQueryConfig effective = config == null ? emptyConfig(type) : config;
        if (effective.getWidgetType() != type) {
            throw new ConfigException("Configuration for " + effective.getWidgetType().getKey()
                    + " cannot be used with a " + type.getKey() + " widget");
        }

        Pagination page = (pagination == null ? Pagination.unspecified() : pagination)
                .withDefaults(defaultPage, defaultPageSize);

        QueryParams.Builder params = QueryParams.builder()
                .put("schemaName", schemaName)
                .put("tableName", tableName)
                .put("page", page.page())
                .put("pageSize", page.pageSize());

        applyFilters(params, effective, columns, now);

        if (effective instanceof ChartConfig chart) {
            applyChart(params, chart);
        } else if (effective instanceof MetricConfig metric) {
            applyMetric(params, metric);
        } else if (effective instanceof TableConfig table) {
            applyTable(params, table);
        }

        QueryParams result = params.build();
        log.debug("Built {} query params for {}.{}: {}", type.getKey(), schemaName, tableName, result.keySet());
        return result;
    }

    /**
     * Charts are aggregated when they aggregate, group or bucket; metrics always are; tables never are.
     */
    public static boolean isAggregated(WidgetQueryConfig config) {
        if (config instanceof ChartConfig chart) {
            return chart.isAggregated();
        }
        return config instanceof MetricConfig;
    }

    private void applyFilters(QueryParams.Builder params, WidgetQueryConfig config,
                              List<ColumnMeta> columns, Instant now) {
        if (config.getFilters() == null) {
            return;
        }
        FilterCategories categories = filterCategorizer.categorize(config.getFilters(), isAggregated(config));

        List<CompiledPredicate> where = filterCompiler.compile(categories.whereFilters(), columns, now);
        params.put("filters", toWire(where));

        List<CompiledPredicate> having = filterCompiler.compileHaving(categories.havingFilters(), now);
        if (!having.isEmpty()) {
            params.put("havingFilters", toWire(having));
        }
    }

    private static void applyChart(QueryParams.Builder params, ChartConfig chart) {
        params.put("xAxis", blankToNull(chart.getXAxis()));
        params.put("yAxis", orWildcard(chart.getYAxis()));
        params.put("aggregation", aggregationName(chart.getAggregation()));
        if (chart.hasGroupBy()) {
            params.put("groupBy", List.copyOf(chart.getGroupBy()));
        }
        if (chart.getTimeAggregation() != null) {
            params.put("timeAggregation", chart.getTimeAggregation().getKey());
        }
        MultiSeriesConfig multiSeries = chart.getMultiSeries();
        if (multiSeries != null && multiSeries.isEnabled()) {
            Map<String, Object> descriptor = new LinkedHashMap<>();
            descriptor.put("enabled", true);
            if (multiSeries.getMaxSeries() != null) {
                descriptor.put("maxSeries", multiSeries.getMaxSeries());
            }
            if (multiSeries.getSeriesType() != null) {
                descriptor.put("seriesType", multiSeries.getSeriesType());
            }
            params.put("multiSeries", descriptor);
        }
    }

    private static void applyMetric(QueryParams.Builder params, MetricConfig metric) {
        params.put("aggregation", aggregationName(metric.getAggregation()));
        params.put("aggregationColumn", orWildcard(metric.getMetric()));
    }

    private static void applyTable(QueryParams.Builder params, TableConfig table) {
        if (table.getColumns() != null && !table.getColumns().isEmpty()) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("columns", List.copyOf(table.getColumns()));
            params.put("properties", properties);
        }
        params.put("search", blankToNull(table.getSearch()));
        params.put("sortColumn", blankToNull(table.getSortColumn()));
        if (table.getSortDirection() != null) {
            params.put("sortDirection", table.getSortDirection().getKey());
        }
    }

    private static List<Map<String, Object>> toWire(List<CompiledPredicate> predicates) {
        return predicates.stream()
                .map(QueryParamsBuilder::toWireEntry)
                .toList();
    }

    private static Map<String, Object> toWireEntry(CompiledPredicate predicate) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("column", predicate.column());
        wire.put("operator", predicate.operator().getKey());
        wire.put("sql", predicate.sql());
        wire.put("logicalOperator", predicate.logicalOperator().name());
        return wire;
    }

    private static WidgetQueryConfig emptyConfig(WidgetType type) {
        return switch (type) {
            case CHART -> ChartConfig.builder().build();
            case METRIC -> MetricConfig.builder().build();
            case TABLE -> TableConfig.builder().build();
        };
    }

    private static String aggregationName(AggregationType aggregation) {
        return (aggregation == null ? AggregationType.COUNT : aggregation).getSqlName();
    }

    private static String orWildcard(String value) {
        return value == null || value.isBlank() ? WILDCARD : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigException(name + " is required");
        }
        return value;
    }
}
