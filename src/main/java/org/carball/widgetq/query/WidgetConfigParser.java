package org.carball.widgetq.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.widget.ChartConfig;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.TableConfig;
import org.carball.widgetq.model.widget.WidgetQueryConfig;
import org.carball.widgetq.model.widget.WidgetType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads loosely typed widget configuration (JSON text or a map) into the typed config for a widget type.
 * Keys that belong to other widget types or are unknown are ignored. Filter entries that are not
 * objects are dropped one by one.
 */
@Slf4j
public class WidgetConfigParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public WidgetConfigParser() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    public WidgetQueryConfig parse(WidgetType type, Object rawConfig) {
        if (rawConfig == null) {
            return parseMap(type, Map.of());
        }
        if (rawConfig instanceof WidgetQueryConfig typed) {
            return typed;
        }
        if (rawConfig instanceof String json) {
            return parseMap(type, readJson(json));
        }
        if (rawConfig instanceof Map<?, ?> map) {
            return parseMap(type, toStringKeyed(map));
        }
        log.warn("Unsupported config value of type {}, using an empty {} config",
                rawConfig.getClass().getSimpleName(), type.getKey());
        return parseMap(type, Map.of());
    }

    public Map<String, Object> readJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> result = mapper.readValue(json, MAP_TYPE);
            return result == null ? Map.of() : result;
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid JSON configuration", e);
        }
    }

    private WidgetQueryConfig parseMap(WidgetType type, Map<String, Object> raw) {
        Map<String, Object> fields = new LinkedHashMap<>(raw);
        Object filters = fields.remove("filters");

        Class<? extends WidgetQueryConfig> target = switch (type) {
            case CHART -> ChartConfig.class;
            case METRIC -> MetricConfig.class;
            case TABLE -> TableConfig.class;
        };

        WidgetQueryConfig config;
        try {
            config = mapper.convertValue(fields, target);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid " + type.getKey() + " configuration: " + rootMessage(e), e);
        }

        if (filters == null) {
            return config;
        }
        return withFilters(config, parseFilters(filters));
    }

    /**
     * Parses a raw filter list. Entries that are not objects or cannot be read are logged and skipped.
     */
    public List<FilterCondition> parseFilters(Object raw) {
        if (!(raw instanceof Collection<?> entries)) {
            log.warn("Ignoring filters: expected a list but got {}", raw.getClass().getSimpleName());
            return List.of();
        }
        List<FilterCondition> conditions = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?>)) {
                log.warn("Ignoring filter entry that is not an object: {}", entry);
                continue;
            }
            try {
                conditions.add(mapper.convertValue(entry, FilterCondition.class));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unreadable filter entry {}: {}", entry, rootMessage(e));
            }
        }
        return conditions;
    }

    static WidgetQueryConfig withFilters(WidgetQueryConfig config, List<FilterCondition> filters) {
        if (config instanceof ChartConfig chart) {
            return chart.toBuilder().filters(filters).build();
        }
        if (config instanceof MetricConfig metric) {
            return metric.toBuilder().filters(filters).build();
        }
        if (config instanceof TableConfig table) {
            return table.toBuilder().filters(filters).build();
        }
        throw new ConfigException("Unsupported config type: " + config.getClass().getSimpleName());
    }

    private static Map<String, Object> toStringKeyed(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
