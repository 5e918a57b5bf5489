package org.carball.widgetq.chart;

import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.model.chart.NumericTransformResult;
import org.carball.widgetq.model.widget.ChartConfig;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Coerces aggregation result fields to numbers. Databases often return numeric aggregates as strings.
 * Values that cannot be read become 0 and are reported as warnings.
 */
@Slf4j
public class NumericTransformer {

    private static final List<String> COMMON_AGGREGATION_FIELDS = List.of(
            "count", "sum", "avg", "average", "min", "max", "total", "amount", "quantity",
            "price", "revenue", "score", "rating", "percentage", "ratio");

    private static final Number DEFAULT_VALUE = 0;

    public NumericTransformResult transformChartData(List<Map<String, Object>> rows, ChartConfig config) {
        return transform(rows, aggregationFields(config));
    }

    public NumericTransformResult transform(List<Map<String, Object>> rows, Set<String> numericFields) {
        List<Map<String, Object>> output = new ArrayList<>(rows.size());
        List<String> warnings = new ArrayList<>();
        int stringConversions = 0;
        int invalidConversions = 0;

        for (int index = 0; index < rows.size(); index++) {
            Map<String, Object> row = rows.get(index);
            if (row == null) {
                warnings.add("Skipped invalid record at index " + index + ": not an object");
                continue;
            }
            Map<String, Object> transformed = new LinkedHashMap<>(row);
            for (String field : numericFields) {
                if (!row.containsKey(field)) {
                    continue;
                }
                Object value = row.get(field);
                if (value instanceof String) {
                    stringConversions++;
                }
                Number number = toNumber(value);
                if (number == null) {
                    invalidConversions++;
                    warnings.add("Field '" + field + "' at record " + index + ": cannot read '" + value
                            + "' as a number, using default");
                    number = DEFAULT_VALUE;
                }
                transformed.put(field, number);
            }
            output.add(transformed);
        }

        if (!warnings.isEmpty()) {
            log.warn("Numeric transform: {} issue(s), first: {}", warnings.size(), warnings.get(0));
        }
        return new NumericTransformResult(output, stringConversions, invalidConversions, warnings);
    }

    /**
     * {@code value} when aggregated, the configured y column and the common aggregate aliases.
     */
    public Set<String> aggregationFields(ChartConfig config) {
        Set<String> fields = new LinkedHashSet<>();
        if (config.getAggregation() != null) {
            fields.add("value");
        }
        if (config.getYAxis() != null && !config.getYAxis().equals("*")) {
            fields.add(config.getYAxis());
        }
        fields.addAll(COMMON_AGGREGATION_FIELDS);
        return fields;
    }

    /**
     * Reads a number, accepting strings with thousands separators or a leading dollar sign.
     * Returns {@code null} when the value cannot be read.
     */
    public static Number toNumber(Object value) {
        if (value instanceof Double d) {
            return d.isNaN() || d.isInfinite() ? null : d;
        }
        if (value instanceof Float f) {
            return f.isNaN() || f.isInfinite() ? null : f;
        }
        if (value instanceof Number n) {
            return n;
        }
        if (!(value instanceof String s)) {
            return null;
        }
        String cleaned = s.trim().replace(",", "");
        if (cleaned.startsWith("$")) {
            cleaned = cleaned.substring(1).trim();
        }
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            BigDecimal decimal = new BigDecimal(cleaned);
            if (decimal.scale() <= 0) {
                try {
                    return decimal.longValueExact();
                } catch (ArithmeticException e) {
                    return decimal.doubleValue();
                }
            }
            return decimal.doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
