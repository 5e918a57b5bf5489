package org.carball.widgetq.model.widget;

import org.carball.widgetq.model.filter.FilterCondition;

import java.util.List;

/**
 * Typed query configuration, one implementation per {@link WidgetType}.
 */
public interface WidgetQueryConfig {

    WidgetType getWidgetType();

    /**
     * Filter conditions, or {@code null} when the config carries no filter list at all.
     */
    List<FilterCondition> getFilters();
}
