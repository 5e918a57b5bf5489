package org.carball.widgetq.model.validation;

import org.carball.widgetq.model.widget.ChartConfig;

import java.util.List;

/**
 * Chart config after time-bucket validation, with any warnings that were raised.
 */
public record TimeAggregationCheck(ChartConfig config, List<String> warnings) {

    public TimeAggregationCheck {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
