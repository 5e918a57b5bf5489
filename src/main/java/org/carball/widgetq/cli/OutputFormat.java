package org.carball.widgetq.cli;

public enum OutputFormat {
    JSON,
    YAML
}
