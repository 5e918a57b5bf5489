package org.carball.widgetq.model.trend;

public record TrendResult(TrendDirection direction, double percentage, double currentValue, double previousValue) {
}
