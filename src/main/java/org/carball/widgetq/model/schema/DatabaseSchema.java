package org.carball.widgetq.model.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
public class DatabaseSchema {
    private List<Table> tables = new ArrayList<>();

    public void addTable(Table table) {
        tables.add(table);
    }

    public Optional<Table> findTable(String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Looks a table up by schema and name. A table parsed without a schema matches any schema.
     */
    public Optional<Table> findTable(String schemaName, String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .filter(t -> t.getSchemaName() == null || schemaName == null
                        || t.getSchemaName().equalsIgnoreCase(schemaName))
                .findFirst();
    }
}
