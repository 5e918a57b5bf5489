package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.carball.widgetq.model.filter.FilterCondition;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableConfig implements WidgetQueryConfig {
    List<String> columns;
    String sortColumn;
    SortDirection sortDirection;
    String search;
    List<FilterCondition> filters;

    @Override
    @JsonIgnore
    public WidgetType getWidgetType() {
        return WidgetType.TABLE;
    }
}
