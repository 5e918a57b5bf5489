package org.carball.widgetq.model.filter;

import java.util.List;

public record FilterCategories(List<FilterCondition> whereFilters, List<FilterCondition> havingFilters) {

    public FilterCategories {
        whereFilters = List.copyOf(whereFilters);
        havingFilters = List.copyOf(havingFilters);
    }
}
