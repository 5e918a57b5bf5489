package org.carball.widgetq.model.chart;

/**
 * Resolved data field and whether it is the synthetic aggregation alias.
 */
public record FieldMapping(String fieldName, boolean aggregation) {
}
