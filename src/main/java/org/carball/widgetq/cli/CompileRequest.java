package org.carball.widgetq.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.widget.WidgetDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Request file read by the CLI. {@code config} stays loosely typed and is parsed per widget type.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompileRequest {
    private WidgetDescriptor widget;
    private Map<String, Object> config;
    private Integer page;
    private Integer pageSize;
    private List<ColumnMeta> columns;
}
