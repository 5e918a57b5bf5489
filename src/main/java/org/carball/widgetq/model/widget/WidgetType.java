package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.carball.widgetq.error.ConfigException;

import java.util.Locale;

public enum WidgetType {
    CHART,
    METRIC,
    TABLE;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WidgetType fromKey(String key) {
        if (key == null) {
            throw new ConfigException("Widget type is required");
        }
        return switch (key.trim().toLowerCase(Locale.ROOT)) {
            case "chart" -> CHART;
            case "metric" -> METRIC;
            case "table" -> TABLE;
            default -> throw new ConfigException("Unsupported widget type: " + key);
        };
    }
}
