package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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
public class ChartConfig implements WidgetQueryConfig {
    @JsonProperty("xAxis")
    String xAxis;

    @JsonProperty("yAxis")
    String yAxis;

    AggregationType aggregation;
    List<String> groupBy;
    TimeAggregation timeAggregation;
    MultiSeriesConfig multiSeries;
    String chartType;
    List<FilterCondition> filters;

    @Override
    @JsonIgnore
    public WidgetType getWidgetType() {
        return WidgetType.CHART;
    }

    @JsonIgnore
    public boolean hasGroupBy() {
        return groupBy != null && !groupBy.isEmpty();
    }

    /**
     * A chart is aggregated when any of aggregation, grouping or time bucketing is configured.
     */
    @JsonIgnore
    public boolean isAggregated() {
        return aggregation != null || hasGroupBy() || timeAggregation != null;
    }
}
