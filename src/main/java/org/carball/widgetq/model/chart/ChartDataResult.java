package org.carball.widgetq.model.chart;

import org.carball.widgetq.model.widget.ChartConfig;

import java.util.List;
import java.util.Map;

public record ChartDataResult(List<Map<String, Object>> chartData,
                              List<String> seriesKeys,
                              ChartConfig originalConfig) {

    public static ChartDataResult empty(ChartConfig config) {
        return new ChartDataResult(List.of(), List.of(), config);
    }

    public boolean isEmpty() {
        return chartData.isEmpty();
    }
}
