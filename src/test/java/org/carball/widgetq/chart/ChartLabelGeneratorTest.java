package org.carball.widgetq.chart;

import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.widget.AggregationType;
import org.carball.widgetq.model.widget.ChartConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ChartLabelGeneratorTest {

    private static final List<ColumnMeta> COLUMNS = List.of(
            ColumnMeta.builder().name("net_revenue").dataType("numeric").displayName("Net Revenue (EUR)").build(),
            ColumnMeta.of("comment_count", "int"));

    private final ChartLabelGenerator generator = new ChartLabelGenerator(30);

    @Test
    public void shouldLabelCountOfAllRecords() {
        ChartConfig chart = ChartConfig.builder().aggregation(AggregationType.COUNT).yAxis("*").build();

        assertThat(generator.generateLabel("value", chart, COLUMNS)).isEqualTo("Total Count");
        assertThat(generator.generateTooltipLabel("value", chart, COLUMNS)).isEqualTo("Total number of records");
    }

    @Test
    public void shouldLabelAggregateOfColumn() {
        ChartConfig sum = ChartConfig.builder().aggregation(AggregationType.SUM).yAxis("comment_count").build();
        ChartConfig count = ChartConfig.builder().aggregation(AggregationType.COUNT).yAxis("comment_count").build();

        assertThat(generator.generateLabel("value", sum, COLUMNS)).isEqualTo("Sum of Comment Count");
        assertThat(generator.generateLabel("value", count, COLUMNS)).isEqualTo("Count of Comment Count");
        assertThat(generator.generateTooltipLabel("value", sum, COLUMNS)).isEqualTo("Total sum of Comment Count");
    }

    @Test
    public void shouldLabelAggregateWithoutColumn() {
        ChartConfig chart = ChartConfig.builder().aggregation(AggregationType.AVG).build();

        assertThat(generator.generateLabel("value", chart, COLUMNS)).isEqualTo("Average Value");
    }

    @Test
    public void shouldPreferDisplayNameOverTitleCase() {
        ChartConfig chart = ChartConfig.builder().yAxis("net_revenue").build();

        assertThat(generator.generateLabel("net_revenue", chart, COLUMNS)).isEqualTo("Net Revenue (EUR)");
        assertThat(generator.generateLabel("comment_count", chart, COLUMNS)).isEqualTo("Comment Count");
    }

    @Test
    public void shouldNotTreatValueAsAggregateWithoutAggregation() {
        ChartConfig chart = ChartConfig.builder().yAxis("value").build();

        assertThat(generator.isAggregationField("value", chart)).isFalse();
        assertThat(generator.generateLabel("value", chart, COLUMNS)).isEqualTo("Value");
    }

    @Test
    public void shouldTruncateLongLabels() {
        ChartLabelGenerator shortLabels = new ChartLabelGenerator(10);

        assertThat(shortLabels.truncate("Quarterly Revenue")).isEqualTo("Quarter...");
        assertThat(shortLabels.truncate("Short")).isEqualTo("Short");
    }

    @Test
    public void shouldLabelEverySeriesKey() {
        ChartConfig chart = ChartConfig.builder().groupBy(List.of("region", "channel")).build();

        Map<String, String> labels = generator.generateLabels(chart, List.of("EU | web", "US | (empty)"), COLUMNS);

        assertThat(labels).containsExactly(Map.entry("EU | web", "EU | web"), Map.entry("US | (empty)", "US | (empty)"));
    }

    @Test
    public void shouldFormatColumnNames() {
        assertThat(ChartLabelGenerator.formatColumnName("comment_count")).isEqualTo("Comment Count");
        assertThat(ChartLabelGenerator.formatColumnName("EMAIL")).isEqualTo("Email");
        assertThat(ChartLabelGenerator.formatColumnName("*")).isEqualTo("all records");
        assertThat(ChartLabelGenerator.formatColumnName(null)).isEqualTo("records");
    }
}
