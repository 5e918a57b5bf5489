package org.carball.widgetq.trend;

import org.carball.widgetq.chart.NumericTransformer;
import org.carball.widgetq.model.trend.TrendDirection;
import org.carball.widgetq.model.trend.TrendResult;

import java.util.List;
import java.util.Map;

public class TrendCalculator {

    private static final List<String> RESULT_COLUMNS = List.of("count", "sum", "avg", "min", "max", "value");

    private final double stableThresholdPercent;

    public TrendCalculator(double stableThresholdPercent) {
        this.stableThresholdPercent = stableThresholdPercent;
    }

    /**
     * Direction and percentage change from {@code previous} to {@code current}, rounded to two decimals.
     * A change smaller than the stable threshold counts as stable.
     */
    public TrendResult calculate(double current, double previous) {
        if (previous == 0) {
            return current > 0
                    ? new TrendResult(TrendDirection.UP, 100, current, previous)
                    : new TrendResult(TrendDirection.STABLE, 0, current, previous);
        }

        double percentage = (current - previous) / previous * 100;
        TrendDirection direction;
        if (Math.abs(percentage) < stableThresholdPercent) {
            direction = TrendDirection.STABLE;
        } else {
            direction = current > previous ? TrendDirection.UP : TrendDirection.DOWN;
        }
        return new TrendResult(direction, round(percentage), current, previous);
    }

    /**
     * Reads the metric value from the first result row: a standard aggregate column first,
     * then any numeric value, otherwise 0.
     */
    public static double extractMetricValue(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty() || rows.get(0) == null) {
            return 0;
        }
        Map<String, Object> first = rows.get(0);

        for (String column : RESULT_COLUMNS) {
            if (first.containsKey(column)) {
                Number number = NumericTransformer.toNumber(first.get(column));
                return number == null ? 0 : number.doubleValue();
            }
        }

        for (Object value : first.values()) {
            Number number = NumericTransformer.toNumber(value);
            if (number != null) {
                return number.doubleValue();
            }
        }
        return 0;
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
