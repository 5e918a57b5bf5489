package org.carball.widgetq.model.trend;

import org.carball.widgetq.model.filter.DateRange;

/**
 * Current period of a trend filter and the equally long period ending where it starts.
 */
public record TrendPeriods(String column, DateRange current, DateRange previous) {
}
