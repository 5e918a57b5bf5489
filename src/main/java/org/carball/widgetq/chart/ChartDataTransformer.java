package org.carball.widgetq.chart;

import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.error.DateParseException;
import org.carball.widgetq.filter.DateResolver;
import org.carball.widgetq.model.chart.ChartDataResult;
import org.carball.widgetq.model.chart.FieldMapping;
import org.carball.widgetq.model.widget.ChartConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps returned rows onto the shape a chart renders: numeric values, epoch-millisecond time axis,
 * and one column per series when grouping is configured.
 */
@Slf4j
public class ChartDataTransformer {

    public static final String TIME_BUCKET_FIELD = "time_bucket";
    public static final String AGGREGATE_FIELD = "value";
    public static final String EMPTY_SERIES = "(empty)";
    public static final String SERIES_SEPARATOR = " | ";

    private static final String DEFAULT_Y_FIELD = "y";

    private static final Pattern TIMESTAMP = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}");

    private final DateResolver dateResolver;
    private final NumericTransformer numericTransformer;
    private final int defaultMaxSeries;

    public ChartDataTransformer(DateResolver dateResolver, NumericTransformer numericTransformer, int defaultMaxSeries) {
        this.dateResolver = dateResolver;
        this.numericTransformer = numericTransformer;
        this.defaultMaxSeries = defaultMaxSeries;
    }

    public ChartDataResult transform(List<Map<String, Object>> rows, ChartConfig config) {
        if (rows == null || rows.isEmpty()) {
            return ChartDataResult.empty(config);
        }

        List<Map<String, Object>> data = numericTransformer.transformChartData(rows, config).data();

        String xField = determineXAxisField(config);
        if (xField != null) {
            data = convertTimestamps(data, xField);
        }

        if (config.hasGroupBy()) {
            return transformMultiSeries(data, config, xField);
        }

        FieldMapping yField = determineYAxisField(config, data);
        return new ChartDataResult(data, List.of(yField.fieldName()), config);
    }

    /**
     * A time-bucketed chart returns its x values under {@code time_bucket}.
     */
    public String determineXAxisField(ChartConfig config) {
        if (config.getTimeAggregation() != null && config.getXAxis() != null) {
            return TIME_BUCKET_FIELD;
        }
        return config.getXAxis();
    }

    /**
     * Uses the configured y field when rows carry it. Otherwise falls back to the synthetic
     * aggregation alias {@code value} when rows carry it or the chart aggregates.
     */
    public FieldMapping determineYAxisField(ChartConfig config, List<Map<String, Object>> rows) {
        String configured = config.getYAxis() == null || config.getYAxis().isBlank()
                ? DEFAULT_Y_FIELD
                : config.getYAxis();
        Map<String, Object> first = rows == null || rows.isEmpty() ? null : rows.get(0);

        if (first != null && first.containsKey(configured)) {
            return new FieldMapping(configured, false);
        }
        boolean aliasPresent = first != null && first.containsKey(AGGREGATE_FIELD);
        if (aliasPresent || config.getAggregation() != null || "*".equals(configured)) {
            return new FieldMapping(AGGREGATE_FIELD, true);
        }
        return new FieldMapping(configured, false);
    }

    List<Map<String, Object>> convertTimestamps(List<Map<String, Object>> rows, String xField) {
        List<Map<String, Object>> converted = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = row.get(xField);
            if (value instanceof String text && TIMESTAMP.matcher(text).find()) {
                Map<String, Object> copy = new LinkedHashMap<>(row);
                try {
                    copy.put(xField, dateResolver.parseInstant(text).toEpochMilli());
                } catch (DateParseException e) {
                    log.debug("Leaving unparseable timestamp '{}' as text", text);
                }
                converted.add(copy);
            } else {
                converted.add(row);
            }
        }
        return converted;
    }

    private ChartDataResult transformMultiSeries(List<Map<String, Object>> rows, ChartConfig config, String xField) {
        String yField = determineYAxisField(config, rows).fieldName();
        if (xField == null) {
            return new ChartDataResult(rows, List.of(yField), config);
        }

        List<String> groupColumns = config.getGroupBy();
        int maxSeries = config.getMultiSeries() != null && config.getMultiSeries().getMaxSeries() != null
                ? config.getMultiSeries().getMaxSeries()
                : defaultMaxSeries;

        Set<String> allowed = topSeries(rows, groupColumns, maxSeries);
        Map<String, Map<String, Object>> pivot = new LinkedHashMap<>();
        Set<String> seriesKeys = new LinkedHashSet<>();

        for (Map<String, Object> row : rows) {
            Object x = row.get(xField);
            Object y = row.get(yField);
            if (x == null || y == null) {
                continue;
            }
            String series = seriesKey(row, groupColumns);
            if (!allowed.contains(series)) {
                continue;
            }
            seriesKeys.add(series);

            Map<String, Object> pivotRow = pivot.computeIfAbsent(String.valueOf(x), key -> {
                Map<String, Object> created = new LinkedHashMap<>();
                created.put(xField, x);
                return created;
            });
            pivotRow.merge(series, y, ChartDataTransformer::combine);
        }

        for (Map<String, Object> pivotRow : pivot.values()) {
            for (String series : seriesKeys) {
                pivotRow.putIfAbsent(series, 0);
            }
        }

        if (seriesKeys.size() < countDistinct(rows, groupColumns)) {
            log.debug("Limited chart to {} of {} series", seriesKeys.size(), countDistinct(rows, groupColumns));
        }
        return new ChartDataResult(new ArrayList<>(pivot.values()), new ArrayList<>(seriesKeys), config);
    }

    /**
     * The most frequent series, ties broken by first appearance.
     */
    private static Set<String> topSeries(List<Map<String, Object>> rows, List<String> groupColumns, int maxSeries) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            frequency.merge(seriesKey(row, groupColumns), 1, Integer::sum);
        }
        return frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(Math.max(maxSeries, 0))
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(HashSet::new));
    }

    private static long countDistinct(List<Map<String, Object>> rows, List<String> groupColumns) {
        return rows.stream().map(row -> seriesKey(row, groupColumns)).distinct().count();
    }

    static String seriesKey(Map<String, Object> row, List<String> groupColumns) {
        return groupColumns.stream()
                .map(column -> {
                    Object value = row.get(column);
                    return value == null ? EMPTY_SERIES : String.valueOf(value);
                })
                .collect(Collectors.joining(SERIES_SEPARATOR));
    }

    /**
     * Duplicate numeric cells are summed; anything else keeps the latest value.
     */
    private static Object combine(Object current, Object next) {
        if (current instanceof Number a && next instanceof Number b) {
            if (isIntegral(a) && isIntegral(b)) {
                return a.longValue() + b.longValue();
            }
            return a.doubleValue() + b.doubleValue();
        }
        return next;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte;
    }
}
