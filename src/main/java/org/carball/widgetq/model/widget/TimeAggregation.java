package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.carball.widgetq.error.ConfigException;

import java.util.Locale;

public enum TimeAggregation {
    HOUR,
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TimeAggregation fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown time aggregation: " + key, e);
        }
    }
}
