package org.carball.widgetq.model.validation;

public record AggregationValidationResult(boolean valid, String error, String suggestion) {

    public static AggregationValidationResult ok() {
        return new AggregationValidationResult(true, null, null);
    }

    public static AggregationValidationResult invalid(String error, String suggestion) {
        return new AggregationValidationResult(false, error, suggestion);
    }
}
