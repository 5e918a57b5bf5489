package org.carball.widgetq.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.filter.FilterCompiler;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.validation.AggregationConfig;
import org.carball.widgetq.model.validation.AggregationValidationResult;
import org.carball.widgetq.model.widget.AggregationType;

import java.util.List;
import java.util.Optional;

/**
 * Checks that an aggregation can be applied to its metric column.
 * Validation only reports; {@link #autoCorrect} is the separate repair step.
 */
@Slf4j
public class AggregationValidator {

    public static final String WILDCARD = "*";

    public AggregationValidationResult validate(String aggregation, String metric, List<ColumnMeta> columns) {
        if (aggregation != null && !aggregation.isBlank() && AggregationType.find(aggregation).isEmpty()) {
            return AggregationValidationResult.invalid(
                    "Unknown aggregation \"" + aggregation + "\".",
                    "Please select one of count, sum, avg, min or max.");
        }
        return validate(AggregationType.find(aggregation).orElse(null), metric, columns);
    }

    public AggregationValidationResult validate(AggregationType aggregation, String metric, List<ColumnMeta> columns) {
        if (aggregation == null) {
            return AggregationValidationResult.invalid(
                    "Aggregation type is required.",
                    "Please select an aggregation function.");
        }

        if (aggregation.isCount()) {
            return AggregationValidationResult.ok();
        }

        if (isWildcard(metric)) {
            return AggregationValidationResult.invalid(
                    aggregation.getSqlName() + " requires a specific column. You cannot "
                            + aggregation.getKey() + " all columns (*).",
                    "Please select a specific numeric column to perform this aggregation on.");
        }

        Optional<ColumnMeta> column = FilterCompiler.findColumn(columns, metric.trim());
        if (column.isEmpty()) {
            return AggregationValidationResult.invalid(
                    "Column \"" + metric + "\" not found in the selected table.",
                    "Please select a valid column from the available options.");
        }

        if (!column.get().isNumeric()) {
            return AggregationValidationResult.invalid(
                    "Cannot perform " + aggregation.getSqlName() + " on non-numeric column \""
                            + metric + "\" (type: " + column.get().getDataType() + ").",
                    "Please select a numeric column for mathematical aggregations, or use COUNT to count records.");
        }

        return AggregationValidationResult.ok();
    }

    public AggregationValidationResult validate(AggregationConfig config, List<ColumnMeta> columns) {
        return validate(config.getAggregation(), config.getMetric(), columns);
    }

    /**
     * Repairs an invalid combination. The result always validates.
     */
    public AggregationConfig autoCorrect(AggregationConfig config, List<ColumnMeta> columns) {
        if (validate(config, columns).valid()) {
            return config;
        }

        if (config.getAggregation() == null) {
            return config.toBuilder().aggregation(AggregationType.COUNT).build();
        }

        String metric = config.getMetric();
        if (metric != null && !metric.isBlank() && isWildcard(metric)) {
            log.debug("Downgrading {} over '*' to COUNT", config.getAggregation());
            return AggregationConfig.of(AggregationType.COUNT, WILDCARD);
        }

        Optional<String> suggested = suggestMetric(config.getAggregation(), columns);
        if (suggested.isPresent()) {
            log.debug("Assigning numeric column '{}' to {}", suggested.get(), config.getAggregation());
            return config.toBuilder().metric(suggested.get()).build();
        }

        log.debug("No numeric column available for {}, falling back to COUNT", config.getAggregation());
        return AggregationConfig.of(AggregationType.COUNT, WILDCARD);
    }

    /**
     * First numeric column for sum/avg/min/max; count needs no column.
     */
    public Optional<String> suggestMetric(AggregationType aggregation, List<ColumnMeta> columns) {
        if (aggregation == null || aggregation.isCount() || columns == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(ColumnMeta::isNumeric)
                .map(ColumnMeta::getName)
                .findFirst();
    }

    public List<ColumnMeta> numericColumns(List<ColumnMeta> columns) {
        return columns == null ? List.of() : columns.stream().filter(ColumnMeta::isNumeric).toList();
    }

    public static String displayName(AggregationType aggregation) {
        return aggregation == null ? "" : aggregation.getDisplayName();
    }

    private static boolean isWildcard(String metric) {
        return metric == null || metric.isBlank() || WILDCARD.equals(metric.trim());
    }
}
