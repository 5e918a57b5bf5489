package org.carball.widgetq.model.chart;

import java.util.List;
import java.util.Map;

public record NumericTransformResult(List<Map<String, Object>> data,
                                     int stringConversions,
                                     int invalidConversions,
                                     List<String> warnings) {
}
