package org.carball.widgetq.model.widget;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class WidgetDescriptor {
    String schemaName;
    String tableName;
    WidgetType widgetType;

    public static WidgetDescriptor of(String schemaName, String tableName, WidgetType widgetType) {
        return new WidgetDescriptor(schemaName, tableName, widgetType);
    }
}
