package org.carball.widgetq.model.validation;

import lombok.Builder;
import lombok.Value;
import org.carball.widgetq.model.widget.AggregationType;

@Value
@Builder(toBuilder = true)
public class AggregationConfig {
    AggregationType aggregation;
    String metric;

    public static AggregationConfig of(AggregationType aggregation, String metric) {
        return new AggregationConfig(aggregation, metric);
    }
}
