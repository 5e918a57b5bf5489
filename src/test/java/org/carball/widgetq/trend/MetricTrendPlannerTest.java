package org.carball.widgetq.trend;

import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.filter.DateResolver;
import org.carball.widgetq.filter.FilterCategorizer;
import org.carball.widgetq.filter.FilterCompiler;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.trend.TrendQueryPlan;
import org.carball.widgetq.model.widget.AggregationType;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.WidgetDescriptor;
import org.carball.widgetq.model.widget.WidgetType;
import org.carball.widgetq.query.QueryParamsBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MetricTrendPlannerTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");

    private static final List<ColumnMeta> COLUMNS = List.of(
            ColumnMeta.of("region", "text"),
            ColumnMeta.of("amount", "numeric"),
            ColumnMeta.of("created_at", "timestamptz"));

    private MetricTrendPlanner planner;

    @BeforeEach
    public void setUp() {
        DateResolver resolver = DateResolver.utc();
        FilterCompiler compiler = new FilterCompiler(resolver, Clock.fixed(NOW, ZoneOffset.UTC));
        QueryParamsBuilder builder = new QueryParamsBuilder(compiler, new FilterCategorizer(), 1, 100);
        planner = new MetricTrendPlanner(builder, new TrendFilterParser(resolver));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldPlanCurrentAndPreviousQueries() {
        // Given
        MetricConfig metric = MetricConfig.builder()
                .aggregation(AggregationType.SUM)
                .metric("amount")
                .filters(List.of(
                        FilterCondition.builder().column("region").operator(FilterOperator.EQ).value("EU").build(),
                        FilterCondition.builder().column("created_at").operator(FilterOperator.DURING)
                                .value("__rel_date:today").config(Map.of("isTrendFilter", true)).build()))
                .build();

        // When
        TrendQueryPlan plan = planner.plan(WidgetDescriptor.of("public", "orders", WidgetType.METRIC),
                metric, null, COLUMNS, NOW);

        // Then
        List<Map<String, Object>> current = (List<Map<String, Object>>) plan.currentQuery().get("filters");
        List<Map<String, Object>> previous = (List<Map<String, Object>>) plan.previousQuery().get("filters");

        assertThat(current).extracting(f -> f.get("sql")).containsExactly(
                "\"region\" = 'EU'",
                "\"created_at\" BETWEEN '2024-03-13T00:00:00.000Z' AND '2024-03-13T23:59:59.999Z'");
        assertThat(previous).extracting(f -> f.get("sql")).containsExactly(
                "\"region\" = 'EU'",
                "\"created_at\" BETWEEN '2024-03-12T00:00:00.001Z' AND '2024-03-13T00:00:00.000Z'");
        assertThat(plan.currentQuery().get("aggregation")).isEqualTo("SUM");
        assertThat(plan.periods().column()).isEqualTo("created_at");
    }

    @Test
    public void shouldOnlyPlanMetricWidgets() {
        assertThatThrownBy(() -> planner.plan(WidgetDescriptor.of("public", "orders", WidgetType.CHART),
                MetricConfig.builder().build(), null, COLUMNS, NOW))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("metric");
    }
}
