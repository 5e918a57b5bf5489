package org.carball.widgetq.model.filter;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum LogicalOperator {
    AND,
    OR;

    @JsonCreator
    public static LogicalOperator fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "AND" -> AND;
            case "OR" -> OR;
            default -> null;
        };
    }
}
