package org.carball.widgetq.error;

/**
 * Raised for structurally invalid engine input: unknown widget types, unknown relative-date
 * names, missing schema or table names, or a configuration that cannot be read.
 */
public class ConfigException extends IllegalArgumentException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
