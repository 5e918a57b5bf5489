package org.carball.widgetq.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.table.ColDataType;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.Index;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.schema.DatabaseSchema;
import org.carball.widgetq.model.schema.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads CREATE TABLE statements into column metadata. Only the parts the engine needs are kept:
 * column names, declared types, nullability and primary keys.
 */
@Slf4j
public class SchemaParser {

    private static final Pattern CREATE_TABLE = Pattern.compile("\\bCREATE\\s+TABLE\\b", Pattern.CASE_INSENSITIVE);

    private SchemaParser() {
        // Utility class - prevent instantiation
    }

    public static DatabaseSchema parseDDL(Path ddlFile) throws IOException {
        String content = Files.readString(ddlFile);
        return parseDDL(content);
    }

    public static DatabaseSchema parseDDL(String ddlContent) {
        DatabaseSchema schema = new DatabaseSchema();
        if (ddlContent == null || ddlContent.isBlank()) {
            return schema;
        }

        try {
            String processedDDL = preprocessDDL(ddlContent);
            Statements statements = CCJSqlParserUtil.parseStatements(processedDDL);
            List<Statement> parsed = statements == null || statements.getStatements() == null
                    ? List.of()
                    : statements.getStatements();

            for (Statement statement : parsed) {
                if (statement instanceof CreateTable createTable) {
                    Table table = convertTable(createTable);
                    schema.addTable(table);
                    log.debug("Parsed table: {} ({} columns)", table.getQualifiedName(), table.getColumns().size());
                }
            }

            // The parser recovers from some syntax errors by skipping the statement
            long declared = CREATE_TABLE.matcher(processedDDL).results().count();
            if (schema.getTables().size() < declared) {
                log.error("Parsed {} of {} CREATE TABLE statements", schema.getTables().size(), declared);
                throw new IllegalArgumentException("Invalid SQL DDL: parsed " + schema.getTables().size()
                        + " of " + declared + " CREATE TABLE statements");
            }
        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        return schema;
    }

    private static String preprocessDDL(String ddlContent) {
        // SQL Server bracket identifiers
        String processed = ddlContent.replaceAll("\\[([^]]+)]", "$1");

        // DEFAULT (GETDATE()) style defaults
        processed = processed.replaceAll("DEFAULT\\s*\\(([A-Z_]+\\(\\))\\)", "DEFAULT '$1'");

        processed = processed.replaceAll("\\bNONCLUSTERED\\b", "");
        processed = processed.replaceAll("\\bCLUSTERED\\b", "");

        return processed.replaceAll("\\s+", " ");
    }

    private static Table convertTable(CreateTable createTable) {
        net.sf.jsqlparser.schema.Table parsed = createTable.getTable();
        Table table = new Table(cleanIdentifier(parsed.getSchemaName()), cleanIdentifier(parsed.getName()));

        Set<String> primaryKeys = tablePrimaryKeys(createTable);

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                table.addColumn(convertColumn(colDef, primaryKeys));
            }
        }

        return table;
    }

    private static Set<String> tablePrimaryKeys(CreateTable createTable) {
        Set<String> primaryKeys = new HashSet<>();
        if (createTable.getIndexes() == null) {
            return primaryKeys;
        }
        for (Index index : createTable.getIndexes()) {
            if ("PRIMARY KEY".equalsIgnoreCase(index.getType()) && index.getColumnsNames() != null) {
                index.getColumnsNames().stream()
                        .map(SchemaParser::cleanIdentifier)
                        .map(name -> name.toLowerCase(Locale.ROOT))
                        .forEach(primaryKeys::add);
            }
        }
        return primaryKeys;
    }

    private static ColumnMeta convertColumn(ColumnDefinition colDef, Set<String> tablePrimaryKeys) {
        String name = cleanIdentifier(colDef.getColumnName());
        boolean nullable = true;
        boolean primaryKey = tablePrimaryKeys.contains(name.toLowerCase(Locale.ROOT));

        if (colDef.getColumnSpecs() != null) {
            List<String> specs = colDef.getColumnSpecs();
            for (int i = 0; i < specs.size(); i++) {
                String upperSpec = specs.get(i).toUpperCase(Locale.ROOT);

                if (upperSpec.equals("NOT NULL")) {
                    nullable = false;
                } else if (upperSpec.equals("NOT") && i + 1 < specs.size()
                        && specs.get(i + 1).equalsIgnoreCase("NULL")) {
                    // JSqlParser may split NOT and NULL into separate specs
                    nullable = false;
                } else if (upperSpec.equals("PRIMARY") || upperSpec.contains("PRIMARY KEY")) {
                    primaryKey = true;
                }
            }
        }

        return ColumnMeta.builder()
                .name(name)
                .dataType(dataType(colDef.getColDataType()))
                .nullable(nullable && !primaryKey)
                .primaryKey(primaryKey)
                .build();
    }

    private static String dataType(ColDataType colDataType) {
        String base = colDataType.getDataType();
        List<String> arguments = colDataType.getArgumentsStringList();
        if (arguments == null || arguments.isEmpty()) {
            return base;
        }
        return base + "(" + String.join(",", arguments) + ")";
    }

    static String cleanIdentifier(String identifier) {
        if (identifier == null) return null;

        // SQL Server brackets, MySQL backticks and Postgres double quotes
        return identifier.replaceAll("[\\[\\]`\"]", "");
    }
}
