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
public class MetricConfig implements WidgetQueryConfig {
    String metric;
    AggregationType aggregation;
    String format;
    String prefix;
    String suffix;
    Boolean showTrend;
    List<FilterCondition> filters;

    @Override
    @JsonIgnore
    public WidgetType getWidgetType() {
        return WidgetType.METRIC;
    }
}
