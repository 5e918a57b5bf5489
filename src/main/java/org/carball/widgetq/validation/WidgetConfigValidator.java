package org.carball.widgetq.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.filter.FilterCompiler;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.schema.DataTypeCategory;
import org.carball.widgetq.model.validation.TimeAggregationCheck;
import org.carball.widgetq.model.widget.AggregationType;
import org.carball.widgetq.model.widget.ChartConfig;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.TableConfig;
import org.carball.widgetq.model.widget.WidgetQueryConfig;
import org.carball.widgetq.model.widget.WidgetType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class WidgetConfigValidator {

    // DATE_TRUNC also works on time columns
    private static final Set<String> TIME_BUCKET_TYPES = Set.of(
            "time", "timetz", "time with time zone", "time without time zone");

    private static final Set<String> LINE_LIKE_CHARTS = Set.of("line", "area");

    /**
     * Drops the time bucket, with a warning, when the x-axis column cannot be truncated to a date part.
     *
     * @throws ConfigException when the x-axis column does not exist
     */
    public TimeAggregationCheck validateTimeAggregation(ChartConfig config, List<ColumnMeta> columns) {
        if (config.getTimeAggregation() == null || config.getXAxis() == null) {
            return new TimeAggregationCheck(config, List.of());
        }

        ColumnMeta xAxis = FilterCompiler.findColumn(columns, config.getXAxis())
                .orElseThrow(() -> new ConfigException("Column '" + config.getXAxis()
                        + "' not found in table. Available columns: " + columnNames(columns)));

        if (isDateColumn(xAxis.getDataType())) {
            return new TimeAggregationCheck(config, List.of());
        }

        String warning = "Time aggregation disabled for non-date column '" + config.getXAxis()
                + "' (type: " + xAxis.getDataType() + "). Time aggregation requires date/timestamp columns.";
        log.warn(warning);
        return new TimeAggregationCheck(config.toBuilder().timeAggregation(null).build(), List.of(warning));
    }

    /**
     * Structural requirements per widget type. Returns the list of problems, empty when valid.
     */
    public List<String> validateRequiredFields(WidgetType type, WidgetQueryConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("Widget configuration is required");
            return errors;
        }
        if (config.getWidgetType() != type) {
            errors.add("Configuration for " + config.getWidgetType().getKey()
                    + " does not match widget type " + type.getKey());
            return errors;
        }
        if (config instanceof ChartConfig chart && (chart.getXAxis() == null || chart.getXAxis().isBlank())) {
            errors.add("Chart widgets require xAxis configuration");
        }
        return errors;
    }

    public WidgetQueryConfig defaultConfig(WidgetType type) {
        return switch (type) {
            case CHART -> ChartConfig.builder()
                    .aggregation(AggregationType.COUNT)
                    .yAxis(AggregationValidator.WILDCARD)
                    .build();
            case METRIC -> MetricConfig.builder()
                    .aggregation(AggregationType.COUNT)
                    .metric(AggregationValidator.WILDCARD)
                    .build();
            case TABLE -> TableConfig.builder()
                    .columns(List.of())
                    .build();
        };
    }

    public List<ColumnMeta> dateColumns(List<ColumnMeta> columns) {
        return columns.stream()
                .filter(c -> isDateColumn(c.getDataType()))
                .toList();
    }

    /**
     * Line and area charts need a date x-axis; other charts also accept categorical columns.
     */
    public List<ColumnMeta> validXAxisColumns(List<ColumnMeta> columns, String chartType) {
        if (chartType != null && LINE_LIKE_CHARTS.contains(chartType)) {
            return dateColumns(columns);
        }
        return columns.stream()
                .filter(c -> isDateColumn(c.getDataType())
                        || c.getCategory() == DataTypeCategory.TEXT
                        || c.getCategory() == DataTypeCategory.ENUM)
                .toList();
    }

    public static boolean isDateColumn(String dataType) {
        return DataTypeCategory.of(dataType).isDate()
                || TIME_BUCKET_TYPES.contains(DataTypeCategory.normalize(dataType));
    }

    private static String columnNames(List<ColumnMeta> columns) {
        return columns == null ? "" : columns.stream().map(ColumnMeta::getName).collect(Collectors.joining(", "));
    }
}
