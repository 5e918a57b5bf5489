package org.carball.widgetq.chart;

import org.carball.widgetq.filter.FilterCompiler;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.widget.AggregationType;
import org.carball.widgetq.model.widget.ChartConfig;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Human-readable labels for chart series.
 * Priority: aggregation label, then column display name, then a Title Case form of the key.
 */
public class ChartLabelGenerator {

    private static final String SEPARATOR = ChartDataTransformer.SERIES_SEPARATOR;

    private final int maxLength;

    public ChartLabelGenerator(int maxLength) {
        this.maxLength = maxLength;
    }

    public Map<String, String> generateLabels(ChartConfig config, List<String> seriesKeys, List<ColumnMeta> columns) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (String key : seriesKeys) {
            labels.put(key, generateLabel(key, config, columns));
        }
        return labels;
    }

    public String generateLabel(String key, ChartConfig config, List<ColumnMeta> columns) {
        if (isAggregationField(key, config)) {
            return aggregationLabel(config);
        }

        String displayName = displayName(key, columns);
        if (displayName != null) {
            return truncate(displayName);
        }

        if (key.contains(SEPARATOR)) {
            String joined = Arrays.stream(key.split(" \\| ", -1))
                    .map(part -> {
                        String partName = displayName(part, columns);
                        return partName != null ? partName : part;
                    })
                    .collect(Collectors.joining(SEPARATOR));
            return truncate(joined);
        }

        return truncate(formatColumnName(key));
    }

    /**
     * Tooltip text. More descriptive than {@link #generateLabel} and never truncated.
     */
    public String generateTooltipLabel(String key, ChartConfig config, List<ColumnMeta> columns) {
        if (!isAggregationField(key, config)) {
            return generateLabel(key, config, columns);
        }
        AggregationType aggregation = config.getAggregation();
        String column = config.getYAxis();
        if (aggregation.isCount()) {
            return "*".equals(column)
                    ? "Total number of records"
                    : aggregation.getVerboseLabel() + " " + formatColumnName(orRecords(column));
        }
        if (column != null && !column.isBlank() && !"*".equals(column)) {
            return aggregation.getVerboseLabel() + " of " + formatColumnName(column);
        }
        return aggregation.getVerboseLabel();
    }

    /**
     * The backend returns aggregates under {@code value}, whatever yAxis was configured.
     */
    public boolean isAggregationField(String key, ChartConfig config) {
        return ChartDataTransformer.AGGREGATE_FIELD.equals(key) && config.getAggregation() != null;
    }

    private String aggregationLabel(ChartConfig config) {
        AggregationType aggregation = config.getAggregation();
        String column = config.getYAxis();

        if (aggregation.isCount()) {
            if ("*".equals(column)) {
                return "Total Count";
            }
            return "Count of " + formatColumnName(orRecords(column));
        }

        if (column != null && !column.isBlank() && !"*".equals(column)) {
            return aggregation.getLabel() + " of " + formatColumnName(column);
        }
        return aggregation.getLabel() + " Value";
    }

    /**
     * {@code comment_count} becomes {@code Comment Count}.
     */
    public static String formatColumnName(String column) {
        if (column == null || column.isEmpty()) {
            return "records";
        }
        if (column.equals("*")) {
            return "all records";
        }
        return Arrays.stream(column.split("_"))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    String truncate(String label) {
        if (label.length() <= maxLength) {
            return label;
        }
        return label.substring(0, Math.max(maxLength - 3, 0)) + "...";
    }

    private static String displayName(String key, List<ColumnMeta> columns) {
        return FilterCompiler.findColumn(columns, key)
                .filter(c -> key.equals(c.getName()))
                .map(ColumnMeta::getDisplayName)
                .filter(name -> !name.isBlank())
                .orElse(null);
    }

    private static String orRecords(String column) {
        return column == null || column.isBlank() ? "records" : column;
    }
}
