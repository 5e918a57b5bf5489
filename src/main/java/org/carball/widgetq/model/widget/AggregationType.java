package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.carball.widgetq.error.ConfigException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AggregationType {
    COUNT("count", "Count records", "Count", "Number of"),
    SUM("sum", "Add up values", "Sum", "Total sum"),
    AVG("avg", "Calculate average", "Average", "Average value"),
    MIN("min", "Find minimum value", "Minimum", "Minimum value"),
    MAX("max", "Find maximum value", "Maximum", "Maximum value");

    private final String key;
    private final String displayName;
    private final String label;
    private final String verboseLabel;

    AggregationType(String key, String displayName, String label, String verboseLabel) {
        this.key = key;
        this.displayName = displayName;
        this.label = label;
        this.verboseLabel = verboseLabel;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getLabel() {
        return label;
    }

    public String getVerboseLabel() {
        return verboseLabel;
    }

    public String getSqlName() {
        return name();
    }

    public boolean isCount() {
        return this == COUNT;
    }

    public static Optional<AggregationType> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.key.equals(normalized))
                .findFirst();
    }

    /**
     * Case-insensitive lookup, {@code "sum"} and {@code "SUM"} both resolve to {@link #SUM}.
     */
    @JsonCreator
    public static AggregationType fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return find(name).orElseThrow(() -> new ConfigException(
                "Unknown aggregation: " + name + ". Valid aggregations: count, sum, avg, min, max"));
    }
}
