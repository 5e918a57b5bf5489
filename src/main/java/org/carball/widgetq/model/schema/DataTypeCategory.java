package org.carball.widgetq.model.schema;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse grouping of declared column types. Normalises Postgres and SQL Server spellings.
 */
public enum DataTypeCategory {
    TEXT,
    NUMERIC,
    BOOLEAN,
    DATE,
    UUID,
    ENUM,
    JSON,
    UNKNOWN;

    private static final Set<String> TEXT_TYPES = Set.of(
            "text", "character varying", "varchar", "character", "char", "bpchar",
            "nvarchar", "nchar", "ntext", "citext", "string");

    // Numeric types accepted by sum/avg/min/max
    private static final Set<String> NUMERIC_TYPES = Set.of(
            "integer", "int", "int2", "int4", "int8", "bigint", "smallint", "tinyint",
            "numeric", "decimal", "real", "float", "float4", "float8", "double precision",
            "double", "money", "smallmoney", "serial", "bigserial", "smallserial");

    private static final Set<String> BOOLEAN_TYPES = Set.of("boolean", "bool", "bit");

    private static final Set<String> DATE_TYPES = Set.of(
            "date", "timestamp", "timestamptz", "timestamp with time zone",
            "timestamp without time zone", "datetime", "datetime2", "smalldatetime",
            "datetimeoffset");

    private static final Set<String> UUID_TYPES = Set.of("uuid", "uniqueidentifier");

    private static final Set<String> JSON_TYPES = Set.of("json", "jsonb");

    public static DataTypeCategory of(String dataType) {
        String normalized = normalize(dataType);
        if (normalized.isEmpty()) {
            return UNKNOWN;
        }
        if (TEXT_TYPES.contains(normalized)) {
            return TEXT;
        }
        if (NUMERIC_TYPES.contains(normalized)) {
            return NUMERIC;
        }
        if (BOOLEAN_TYPES.contains(normalized)) {
            return BOOLEAN;
        }
        if (DATE_TYPES.contains(normalized)) {
            return DATE;
        }
        if (UUID_TYPES.contains(normalized)) {
            return UUID;
        }
        if (JSON_TYPES.contains(normalized)) {
            return JSON;
        }
        if (normalized.equals("enum") || normalized.equals("user-defined")) {
            return ENUM;
        }
        return UNKNOWN;
    }

    /**
     * Lower-cases the type name, strips any length or precision suffix and collapses whitespace.
     * {@code "VARCHAR(255)"} becomes {@code "varchar"}, {@code "timestamp(3) with time zone"}
     * becomes {@code "timestamp with time zone"}.
     */
    public static String normalize(String dataType) {
        if (dataType == null) {
            return "";
        }
        return dataType.toLowerCase(Locale.ROOT)
                .replaceAll("\\([^)]*\\)", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public boolean isNumeric() {
        return this == NUMERIC;
    }

    public boolean isDate() {
        return this == DATE;
    }
}
