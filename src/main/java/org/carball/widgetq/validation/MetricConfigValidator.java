package org.carball.widgetq.validation;

import org.carball.widgetq.model.validation.ValidationIssue;
import org.carball.widgetq.model.validation.ValidationResult;
import org.carball.widgetq.model.widget.AggregationType;
import org.carball.widgetq.model.widget.MetricConfig;

import java.util.List;

/**
 * The metric form rule: every aggregation except count needs a concrete column.
 * Never corrects the config.
 */
public class MetricConfigValidator {

    public static final String COLUMN_REQUIRED = "dashboard:validation.columnRequired";

    public ValidationResult validate(MetricConfig config) {
        return validate(config.getAggregation(), config.getMetric());
    }

    public ValidationResult validate(AggregationType aggregation, String metric) {
        if (aggregation == null || aggregation.isCount()) {
            return ValidationResult.ok();
        }
        if (metric == null || metric.trim().isEmpty() || metric.trim().equals(AggregationValidator.WILDCARD)) {
            return ValidationResult.error(new ValidationIssue(
                    List.of("metric"),
                    COLUMN_REQUIRED,
                    aggregation.getSqlName() + " requires a column",
                    "Please select a specific numeric column to perform this aggregation on."));
        }
        return ValidationResult.ok();
    }

    public void validateOrThrow(MetricConfig config) {
        validate(config).orThrow();
    }
}
