package org.carball.widgetq.error;

import lombok.Getter;

@Getter
public class DateParseException extends IllegalArgumentException {

    private final String value;

    public DateParseException(String value) {
        super("Unable to parse date value: '" + value + "'");
        this.value = value;
    }

    public DateParseException(String value, Throwable cause) {
        super("Unable to parse date value: '" + value + "'", cause);
        this.value = value;
    }
}
