package org.carball.widgetq.model.filter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One user-authored filter. {@code operator} is {@code null} when the wire key was not recognised.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterCondition {
    String column;
    FilterOperator operator;
    Object value;
    LogicalOperator logicalOperator;
    Map<String, Object> config;

    @JsonIgnore
    public boolean isTrendFilter() {
        return config != null && Boolean.TRUE.equals(config.get("isTrendFilter"));
    }

    @JsonIgnore
    public LogicalOperator getEffectiveLogicalOperator() {
        return logicalOperator == null ? LogicalOperator.AND : logicalOperator;
    }
}
