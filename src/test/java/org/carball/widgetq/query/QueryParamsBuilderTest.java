package org.carball.widgetq.query;

import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.filter.DateResolver;
import org.carball.widgetq.filter.FilterCategorizer;
import org.carball.widgetq.filter.FilterCompiler;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.widget.AggregationType;
import org.carball.widgetq.model.widget.ChartConfig;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.MultiSeriesConfig;
import org.carball.widgetq.model.widget.Pagination;
import org.carball.widgetq.model.widget.QueryParams;
import org.carball.widgetq.model.widget.SortDirection;
import org.carball.widgetq.model.widget.TableConfig;
import org.carball.widgetq.model.widget.TimeAggregation;
import org.carball.widgetq.model.widget.WidgetDescriptor;
import org.carball.widgetq.model.widget.WidgetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryParamsBuilderTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");

    private static final List<ColumnMeta> COLUMNS = List.of(
            ColumnMeta.of("email", "varchar(255)"),
            ColumnMeta.of("region", "text"),
            ColumnMeta.of("amount", "numeric"),
            ColumnMeta.of("created_at", "timestamptz"));

    private QueryParamsBuilder builder;
    private WidgetConfigParser parser;

    @BeforeEach
    public void setUp() {
        FilterCompiler compiler = new FilterCompiler(DateResolver.utc(), Clock.fixed(NOW, ZoneOffset.UTC));
        builder = new QueryParamsBuilder(compiler, new FilterCategorizer(), 1, 100);
        parser = new WidgetConfigParser();
    }

    @Test
    public void shouldPassTimeBucketThroughForChart() {
        // Given
        ChartConfig chart = (ChartConfig) parser.parse(WidgetType.CHART,
                Map.of("xAxis", "email", "timeAggregation", "day"));

        // When
        QueryParams params = builder.build(widget(WidgetType.CHART), chart, null, COLUMNS, NOW);

        // Then
        assertThat(params.get("xAxis")).isEqualTo("email");
        assertThat(params.get("timeAggregation")).isEqualTo("day");
        assertThat(params.containsKey("xAxisDataType")).isFalse();
    }

    @Test
    public void shouldUpperCaseAggregation() {
        ChartConfig chart = (ChartConfig) parser.parse(WidgetType.CHART, Map.of("xAxis", "region", "aggregation", "sum",
                "yAxis", "amount"));

        QueryParams params = builder.build(widget(WidgetType.CHART), chart, null, COLUMNS, NOW);

        assertThat(params.get("aggregation")).isEqualTo("SUM");
        assertThat(params.get("yAxis")).isEqualTo("amount");
    }

    @Test
    public void shouldDefaultChartAxesAndAggregation() {
        QueryParams params = builder.build(widget(WidgetType.CHART), ChartConfig.builder().xAxis("region").build(),
                null, COLUMNS, NOW);

        assertThat(params.keySet()).containsExactly("schemaName", "tableName", "page", "pageSize",
                "xAxis", "yAxis", "aggregation");
        assertThat(params.get("yAxis")).isEqualTo("*");
        assertThat(params.get("aggregation")).isEqualTo("COUNT");
    }

    @Test
    public void shouldNeverEmitChartKeysForTables() {
        // Given: a table config carrying chart-only keys
        TableConfig table = (TableConfig) parser.parse(WidgetType.TABLE, Map.of(
                "xAxis", "email", "yAxis", "amount", "timeAggregation", "day", "columns", List.of("email")));

        // When
        QueryParams params = builder.build(widget(WidgetType.TABLE), table, Pagination.of(2, 25), COLUMNS, NOW);

        // Then
        assertThat(params.keySet()).doesNotContain("xAxis", "yAxis", "timeAggregation", "aggregation");
        assertThat(params.get("properties")).isEqualTo(Map.of("columns", List.of("email")));
        assertThat(params.get("page")).isEqualTo(2);
        assertThat(params.get("pageSize")).isEqualTo(25);
    }

    @Test
    public void shouldEmitTableSortingAndSearch() {
        TableConfig table = TableConfig.builder()
                .sortColumn("created_at")
                .sortDirection(SortDirection.DESC)
                .search("acme")
                .build();

        QueryParams params = builder.build(widget(WidgetType.TABLE), table, null, COLUMNS, NOW);

        assertThat(params.get("sortColumn")).isEqualTo("created_at");
        assertThat(params.get("sortDirection")).isEqualTo("desc");
        assertThat(params.get("search")).isEqualTo("acme");
        assertThat(params.containsKey("properties")).isFalse();
    }

    @Test
    public void shouldEmitMetricAggregationColumn() {
        MetricConfig metric = MetricConfig.builder().aggregation(AggregationType.AVG).metric("amount").build();

        QueryParams params = builder.build(widget(WidgetType.METRIC), metric, null, COLUMNS, NOW);

        assertThat(params.get("aggregation")).isEqualTo("AVG");
        assertThat(params.get("aggregationColumn")).isEqualTo("amount");
        assertThat(params.keySet()).doesNotContain("xAxis", "yAxis", "timeAggregation");
    }

    @Test
    public void shouldFallBackToDefaultPagination() {
        QueryParams params = builder.build(widget(WidgetType.METRIC), null, new Pagination(0, null), COLUMNS, NOW);

        assertThat(params.get("page")).isEqualTo(1);
        assertThat(params.get("pageSize")).isEqualTo(100);
        assertThat(params.get("aggregation")).isEqualTo("COUNT");
        assertThat(params.get("aggregationColumn")).isEqualTo("*");
    }

    @Test
    public void shouldCompileWhereAndHavingFilters() {
        ChartConfig chart = ChartConfig.builder()
                .xAxis("region")
                .aggregation(AggregationType.SUM)
                .yAxis("amount")
                .filters(List.of(
                        filter("region", FilterOperator.EQ, "EU"),
                        filter("value", FilterOperator.GT, 1000),
                        filter("unknown", FilterOperator.EQ, "x")))
                .build();

        QueryParams params = builder.build(widget(WidgetType.CHART), chart, null, COLUMNS, NOW);

        assertThat(params.get("filters")).isEqualTo(List.of(Map.of(
                "column", "region", "operator", "eq", "sql", "\"region\" = 'EU'", "logicalOperator", "AND")));
        assertThat(params.get("havingFilters")).isEqualTo(List.of(Map.of(
                "column", "value", "operator", "gt", "sql", "\"value\" > 1000", "logicalOperator", "AND")));
    }

    @Test
    public void shouldKeepFiltersWhenColumnMetadataIsMissing() {
        // Given
        TableConfig table = TableConfig.builder()
                .filters(List.of(
                        filter("status", FilterOperator.EQ, "active"),
                        filter("status", FilterOperator.CONTAINS, "act")))
                .build();

        // When
        QueryParams withoutColumns = builder.build(widget(WidgetType.TABLE), table, null, null, NOW);
        QueryParams withEmptyColumns = builder.build(widget(WidgetType.TABLE), table, null, List.of(), NOW);

        // Then
        assertThat(withoutColumns.get("filters")).isEqualTo(List.of(Map.of(
                "column", "status", "operator", "eq", "sql", "\"status\" = 'active'", "logicalOperator", "AND")));
        assertThat(withEmptyColumns).isEqualTo(withoutColumns);
    }

    @Test
    public void shouldOmitFiltersKeyWhenNotConfigured() {
        QueryParams params = builder.build(widget(WidgetType.TABLE), TableConfig.builder().build(), null, COLUMNS, NOW);

        assertThat(params.containsKey("filters")).isFalse();
        assertThat(params.containsKey("havingFilters")).isFalse();
    }

    @Test
    public void shouldEmitMultiSeriesAndGroupBy() {
        ChartConfig chart = ChartConfig.builder()
                .xAxis("created_at")
                .groupBy(List.of("region"))
                .timeAggregation(TimeAggregation.MONTH)
                .multiSeries(MultiSeriesConfig.builder().enabled(true).maxSeries(5).build())
                .build();

        QueryParams params = builder.build(widget(WidgetType.CHART), chart, null, COLUMNS, NOW);

        assertThat(params.get("groupBy")).isEqualTo(List.of("region"));
        assertThat(params.get("multiSeries")).isEqualTo(Map.of("enabled", true, "maxSeries", 5));
    }

    @Test
    public void shouldBeIdempotent() {
        ChartConfig chart = ChartConfig.builder()
                .xAxis("created_at")
                .timeAggregation(TimeAggregation.WEEK)
                .filters(List.of(filter("created_at", FilterOperator.DURING, "__rel_date:lastMonth")))
                .build();

        QueryParams first = builder.build(widget(WidgetType.CHART), chart, null, COLUMNS, NOW);
        QueryParams second = builder.build(widget(WidgetType.CHART), chart, null, COLUMNS, NOW);

        assertThat(first).isEqualTo(second);
        assertThat(first.toJson()).isEqualTo(second.toJson());
    }

    @Test
    public void shouldRequireSchemaAndTable() {
        assertThatThrownBy(() -> builder.build(WidgetDescriptor.of(" ", "orders", WidgetType.TABLE),
                null, null, COLUMNS, NOW))
                .isInstanceOf(ConfigException.class)
                .hasMessage("schemaName is required");
        assertThatThrownBy(() -> builder.build(WidgetDescriptor.of("public", null, WidgetType.TABLE),
                null, null, COLUMNS, NOW))
                .isInstanceOf(ConfigException.class)
                .hasMessage("tableName is required");
    }

    @Test
    public void shouldRejectConfigOfAnotherWidgetType() {
        assertThatThrownBy(() -> builder.build(widget(WidgetType.TABLE), MetricConfig.builder().build(),
                null, COLUMNS, NOW))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("metric");
    }

    @Test
    public void shouldDetectAggregatedConfigs() {
        assertThat(QueryParamsBuilder.isAggregated(ChartConfig.builder().xAxis("region").build())).isFalse();
        assertThat(QueryParamsBuilder.isAggregated(ChartConfig.builder().groupBy(List.of("region")).build())).isTrue();
        assertThat(QueryParamsBuilder.isAggregated(MetricConfig.builder().build())).isTrue();
        assertThat(QueryParamsBuilder.isAggregated(TableConfig.builder().build())).isFalse();
    }

    private static WidgetDescriptor widget(WidgetType type) {
        return WidgetDescriptor.of("public", "orders", type);
    }

    private static FilterCondition filter(String column, FilterOperator operator, Object value) {
        return FilterCondition.builder().column(column).operator(operator).value(value).build();
    }
}
