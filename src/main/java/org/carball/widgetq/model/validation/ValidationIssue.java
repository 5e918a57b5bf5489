package org.carball.widgetq.model.validation;

import java.util.List;

public record ValidationIssue(List<String> path, String messageKey, String message, String suggestion) {

    public ValidationIssue {
        path = path == null ? List.of() : List.copyOf(path);
    }
}
