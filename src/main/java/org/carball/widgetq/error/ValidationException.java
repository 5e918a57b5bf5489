package org.carball.widgetq.error;

import lombok.Getter;

import java.util.List;

/**
 * Field-scoped validation failure. {@code messageKey} is machine checkable and
 * {@code path} names the offending config field, e.g. {@code [metric]}.
 */
@Getter
public class ValidationException extends IllegalArgumentException {

    private final String messageKey;
    private final List<String> path;
    private final String suggestion;

    public ValidationException(String messageKey, List<String> path, String message, String suggestion) {
        super(message);
        this.messageKey = messageKey;
        this.path = path == null ? List.of() : List.copyOf(path);
        this.suggestion = suggestion;
    }

    public ValidationException(String messageKey, String message) {
        this(messageKey, List.of(), message, null);
    }
}
