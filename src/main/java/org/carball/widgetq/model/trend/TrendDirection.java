package org.carball.widgetq.model.trend;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    UP,
    DOWN,
    STABLE;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
