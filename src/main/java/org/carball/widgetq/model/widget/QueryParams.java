package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled, backend-agnostic query parameters. Keys keep insertion order and a key is either
 * present with a non-null value or absent.
 */
@EqualsAndHashCode
public final class QueryParams {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, false);

    private final Map<String, Object> values;

    private QueryParams(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        values.forEach(builder::put);
        return builder;
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public Set<String> keySet() {
        return values.keySet();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize query params", e);
        }
    }

    @Override
    public String toString() {
        return "QueryParams" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a key. Null values are ignored so the key stays absent.
         */
        public Builder put(String key, Object value) {
            if (value != null) {
                values.put(key, value);
            }
            return this;
        }

        public Builder remove(String key) {
            values.remove(key);
            return this;
        }

        public QueryParams build() {
            return new QueryParams(values);
        }
    }
}
