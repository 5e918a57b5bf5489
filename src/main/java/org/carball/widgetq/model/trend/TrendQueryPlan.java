package org.carball.widgetq.model.trend;

import org.carball.widgetq.model.widget.QueryParams;

public record TrendQueryPlan(QueryParams currentQuery, QueryParams previousQuery, TrendPeriods periods) {
}
