package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SortDirection fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        return key.trim().equalsIgnoreCase("desc") ? DESC : ASC;
    }
}
