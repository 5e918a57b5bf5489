package org.carball.widgetq.model.schema;

import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@RequiredArgsConstructor
public class Table {
    private final String schemaName;
    private final String name;
    private List<ColumnMeta> columns = new ArrayList<>();

    public void addColumn(ColumnMeta column) {
        columns.add(column);
    }

    public String getQualifiedName() {
        return schemaName == null ? name : schemaName + "." + name;
    }
}
