package org.carball.widgetq.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.error.ValidationException;
import org.carball.widgetq.model.filter.CompiledPredicate;
import org.carball.widgetq.model.filter.DateRange;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.filter.ResolvedDate;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.schema.DataTypeCategory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.carball.widgetq.filter.DateResolver.formatIso;

/**
 * Compiles {@link FilterCondition}s into quoted predicate fragments.
 * <p>
 * {@link #compile} is tolerant: a condition that cannot be compiled is logged and skipped.
 * {@link #compileCondition} is the strict path and raises.
 */
@Slf4j
public class FilterCompiler {

    private static final Pattern YEAR_OR_ID = Pattern.compile("^\\d{1,4}$");

    private static final Pattern AGGREGATE_CALL =
            Pattern.compile("^(count|sum|avg|min|max)\\s*\\(\\s*(\\*|[A-Za-z_][A-Za-z0-9_]*)\\s*\\)$",
                    Pattern.CASE_INSENSITIVE);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final DateResolver dateResolver;
    private final QuotingStrategy quoting;
    private final Clock clock;

    public FilterCompiler(DateResolver dateResolver, QuotingStrategy quoting, Clock clock) {
        this.dateResolver = dateResolver;
        this.quoting = quoting;
        this.clock = clock;
    }

    public FilterCompiler(DateResolver dateResolver, Clock clock) {
        this(dateResolver, new PostgresQuotingStrategy(), clock);
    }

    public List<CompiledPredicate> compile(List<FilterCondition> conditions, List<ColumnMeta> columns) {
        return compile(conditions, columns, clock.instant());
    }

    public List<CompiledPredicate> compile(List<FilterCondition> conditions, List<ColumnMeta> columns, Instant now) {
        if (conditions == null || conditions.isEmpty()) {
            return List.of();
        }
        List<CompiledPredicate> predicates = new ArrayList<>();
        for (FilterCondition condition : conditions) {
            tryCompile(() -> compileCondition(condition, columns, now), condition)
                    .ifPresent(predicates::add);
        }
        log.debug("Compiled {} of {} filter conditions", predicates.size(), conditions.size());
        return predicates;
    }

    public CompiledPredicate compileCondition(FilterCondition condition, List<ColumnMeta> columns) {
        return compileCondition(condition, columns, clock.instant());
    }

    /**
     * Compiles one condition or throws. Without any column metadata the column is treated as
     * {@link DataTypeCategory#UNKNOWN}: only the fallback operators are accepted, with text quoting.
     */
    public CompiledPredicate compileCondition(FilterCondition condition, List<ColumnMeta> columns, Instant now) {
        checkShape(condition);
        if (columns == null || columns.isEmpty()) {
            return compileUntyped(condition, now);
        }
        ColumnMeta column = findColumn(columns, condition.getColumn())
                .orElseThrow(() -> new ValidationException("filter.columnNotFound", List.of("column"),
                        "Column \"" + condition.getColumn() + "\" not found in the selected table.", null));

        if (!OperatorCatalog.isLegal(column.getDataType(), condition.getOperator())) {
            throw new ValidationException("filter.operatorNotAllowed", List.of("operator"),
                    "Operator '" + condition.getOperator() + "' is not valid for column \""
                            + column.getName() + "\" of type " + column.getDataType(),
                    "Use one of: " + OperatorCatalog.operatorsFor(column.getDataType()));
        }
        return compileAgainst(condition, column.getCategory(), quoting.quoteIdentifier(column.getName()), now);
    }

    private CompiledPredicate compileUntyped(FilterCondition condition, Instant now) {
        if (!OperatorCatalog.operatorsFor(DataTypeCategory.UNKNOWN).contains(condition.getOperator())) {
            throw new ValidationException("filter.operatorNotAllowed", List.of("operator"),
                    "Operator '" + condition.getOperator() + "' needs column metadata for \""
                            + condition.getColumn() + "\"",
                    "Use one of: " + OperatorCatalog.operatorsFor(DataTypeCategory.UNKNOWN));
        }
        return compileAgainst(condition, DataTypeCategory.UNKNOWN, quoting.quoteIdentifier(condition.getColumn()), now);
    }

    /**
     * Compiles filters over aggregate aliases for a HAVING clause. Every alias is treated as numeric.
     */
    public List<CompiledPredicate> compileHaving(List<FilterCondition> conditions) {
        return compileHaving(conditions, clock.instant());
    }

    public List<CompiledPredicate> compileHaving(List<FilterCondition> conditions, Instant now) {
        if (conditions == null || conditions.isEmpty()) {
            return List.of();
        }
        List<CompiledPredicate> predicates = new ArrayList<>();
        for (FilterCondition condition : conditions) {
            tryCompile(() -> {
                checkShape(condition);
                return compileAgainst(condition, DataTypeCategory.NUMERIC, aggregateTarget(condition.getColumn()), now);
            }, condition).ifPresent(predicates::add);
        }
        return predicates;
    }

    /**
     * Builds a WHERE clause from the compilable conditions, or an empty string when none survive.
     */
    public String buildWhere(List<FilterCondition> conditions, List<ColumnMeta> columns) {
        return buildWhere(conditions, columns, clock.instant());
    }

    public String buildWhere(List<FilterCondition> conditions, List<ColumnMeta> columns, Instant now) {
        String joined = join(compile(conditions, columns, now));
        return joined.isEmpty() ? "" : "WHERE " + joined;
    }

    /**
     * Joins predicates left to right. Each predicate's own logical operator links it to the next one.
     */
    public static String join(List<CompiledPredicate> predicates) {
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < predicates.size(); i++) {
            if (i > 0) {
                sql.append(' ').append(predicates.get(i - 1).logicalOperator()).append(' ');
            }
            sql.append(predicates.get(i).sql());
        }
        return sql.toString();
    }

    public static Optional<ColumnMeta> findColumn(List<ColumnMeta> columns, String name) {
        if (columns == null || name == null) {
            return Optional.empty();
        }
        Optional<ColumnMeta> exact = columns.stream()
                .filter(c -> name.equals(c.getName()))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return columns.stream()
                .filter(c -> name.equalsIgnoreCase(c.getName()))
                .findFirst();
    }

    private Optional<CompiledPredicate> tryCompile(PredicateSupplier supplier, FilterCondition condition) {
        try {
            return Optional.of(supplier.get());
        } catch (IllegalArgumentException e) {
            log.warn("Skipping filter condition on column '{}': {}",
                    condition == null ? null : condition.getColumn(), e.getMessage());
            return Optional.empty();
        }
    }

    private static void checkShape(FilterCondition condition) {
        if (condition == null) {
            throw new ValidationException("filter.invalid", "Filter condition is missing");
        }
        if (condition.getColumn() == null || condition.getColumn().isBlank()) {
            throw new ValidationException("filter.columnRequired", List.of("column"),
                    "Filter condition has no column", null);
        }
        if (condition.getOperator() == null) {
            throw new ValidationException("filter.operatorRequired", List.of("operator"),
                    "Filter condition on \"" + condition.getColumn() + "\" has no valid operator", null);
        }
        if (condition.getOperator().requiresValue() && isMissing(condition.getValue())) {
            throw new ValidationException("filter.valueRequired", List.of("value"),
                    "Operator '" + condition.getOperator() + "' requires a value", null);
        }
    }

    private static boolean isMissing(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private CompiledPredicate compileAgainst(FilterCondition condition, DataTypeCategory category,
                                             String target, Instant now) {
        FilterOperator operator = condition.getOperator();
        if (operator == FilterOperator.IS_NULL) {
            return predicate(condition, operator, target + " IS NULL", List.of());
        }
        if (operator == FilterOperator.NOT_NULL) {
            return predicate(condition, operator, target + " IS NOT NULL", List.of());
        }

        return switch (category) {
            case DATE -> compileDate(condition, target, now);
            case NUMERIC -> compileNumeric(condition, target);
            case BOOLEAN -> compileBoolean(condition, target);
            case JSON -> compileJson(condition, target);
            case TEXT, UUID, ENUM, UNKNOWN -> compileText(condition, target);
        };
    }

    private CompiledPredicate compileText(FilterCondition condition, String target) {
        FilterOperator operator = condition.getOperator();
        return switch (operator) {
            case EQ, NEQ -> {
                String value = scalar(condition);
                yield predicate(condition, operator,
                        target + " " + comparison(operator) + " " + quoting.quoteLiteral(value), List.of(value));
            }
            case CONTAINS -> like(condition, target, "%", "%");
            case STARTS_WITH -> like(condition, target, "", "%");
            case ENDS_WITH -> like(condition, target, "%", "");
            case IN, NOT_IN -> {
                List<String> values = listValues(condition);
                String rendered = values.stream().map(quoting::quoteLiteral).collect(Collectors.joining(", "));
                yield predicate(condition, operator, target + membership(operator) + rendered + ")",
                        new ArrayList<>(values));
            }
            default -> throw unsupported(condition, "text");
        };
    }

    private CompiledPredicate like(FilterCondition condition, String target, String prefix, String suffix) {
        String value = scalar(condition);
        return predicate(condition, condition.getOperator(),
                target + " ILIKE " + quoting.quoteLiteral(prefix + value + suffix), List.of(value));
    }

    private CompiledPredicate compileNumeric(FilterCondition condition, String target) {
        FilterOperator operator = condition.getOperator();
        return switch (operator) {
            case EQ, NEQ, LT, LTE, GT, GTE -> {
                BigDecimal number = number(condition.getValue());
                yield predicate(condition, operator,
                        target + " " + comparison(operator) + " " + number.toPlainString(), List.of(number));
            }
            case BETWEEN, NOT_BETWEEN -> {
                List<String> bounds = bounds(condition);
                BigDecimal low = number(bounds.get(0));
                BigDecimal high = number(bounds.get(1));
                String keyword = operator == FilterOperator.BETWEEN ? " BETWEEN " : " NOT BETWEEN ";
                yield predicate(condition, operator,
                        target + keyword + low.toPlainString() + " AND " + high.toPlainString(), List.of(low, high));
            }
            case IN, NOT_IN -> {
                List<BigDecimal> numbers = listValues(condition).stream().map(FilterCompiler::number).toList();
                String rendered = numbers.stream().map(BigDecimal::toPlainString).collect(Collectors.joining(", "));
                yield predicate(condition, operator, target + membership(operator) + rendered + ")",
                        new ArrayList<>(numbers));
            }
            default -> throw unsupported(condition, "numeric");
        };
    }

    private CompiledPredicate compileBoolean(FilterCondition condition, String target) {
        if (condition.getOperator() != FilterOperator.EQ) {
            throw unsupported(condition, "boolean");
        }
        boolean flag = bool(condition.getValue());
        return predicate(condition, FilterOperator.EQ, target + " = " + (flag ? "TRUE" : "FALSE"), List.of(flag));
    }

    private CompiledPredicate compileJson(FilterCondition condition, String target) {
        FilterOperator operator = condition.getOperator();
        String value = scalar(condition);
        return switch (operator) {
            case HAS_KEY -> predicate(condition, operator, target + " ? " + quoting.quoteLiteral(value), List.of(value));
            case KEY_EQUALS -> {
                String json = keyEqualsJson(value);
                yield predicate(condition, operator, target + " @> " + quoting.quoteLiteral(json), List.of(json));
            }
            case PATH_EXISTS -> {
                String path = jsonPath(value);
                yield predicate(condition, operator,
                        target + " #> " + quoting.quoteLiteral(path) + " IS NOT NULL", List.of(path));
            }
            case CONTAINS_TEXT -> {
                String escaped = value.replace("%", "\\%");
                yield predicate(condition, operator,
                        target + "::text ILIKE " + quoting.quoteLiteral("%" + escaped + "%"), List.of(value));
            }
            default -> throw unsupported(condition, "json");
        };
    }

    private CompiledPredicate compileDate(FilterCondition condition, String target, Instant now) {
        FilterOperator original = condition.getOperator();
        FilterOperator operator = OperatorCatalog.mapDateOperator(original);

        if (original == FilterOperator.DURING) {
            DateRange range = range(condition, now);
            return rangePredicate(condition, operator, target, " BETWEEN ", range);
        }

        return switch (operator) {
            case BETWEEN, NOT_BETWEEN -> rangePredicate(condition, operator, target,
                    operator == FilterOperator.BETWEEN ? " BETWEEN " : " NOT BETWEEN ", range(condition, now));
            case EQ, NEQ -> {
                String value = scalar(condition);
                if (YEAR_OR_ID.matcher(value.trim()).matches()) {
                    yield predicate(condition, operator,
                            target + " " + comparison(operator) + " " + quoting.quoteLiteral(value.trim()),
                            List.of(value.trim()));
                }
                DateRange range = dateResolver.resolve(value, operator, now).range();
                yield rangePredicate(condition, operator, target,
                        operator == FilterOperator.EQ ? " BETWEEN " : " NOT BETWEEN ", range);
            }
            case LT, LTE, GT, GTE -> {
                ResolvedDate resolved = dateResolver.resolve(scalar(condition), now);
                Instant bound = operator == FilterOperator.LT || operator == FilterOperator.GTE
                        ? resolved.lowerBound()
                        : resolved.upperBound();
                String iso = formatIso(bound);
                yield predicate(condition, operator,
                        target + " " + comparison(operator) + " " + quoting.quoteLiteral(iso), List.of(iso));
            }
            default -> throw unsupported(condition, "date");
        };
    }

    private CompiledPredicate rangePredicate(FilterCondition condition, FilterOperator operator, String target,
                                             String keyword, DateRange range) {
        String start = formatIso(range.start());
        String end = formatIso(range.end());
        return predicate(condition, operator,
                target + keyword + quoting.quoteLiteral(start) + " AND " + quoting.quoteLiteral(end),
                List.of(start, end));
    }

    /**
     * A date range from a relative token, a two-element list or a {@code "start,end"} string.
     * A date-only end bound covers its whole day.
     */
    private DateRange range(FilterCondition condition, Instant now) {
        Object value = condition.getValue();
        if (DateResolver.isRelativeDate(value)) {
            return dateResolver.relativeRange((String) value, now);
        }
        if (value instanceof String s && !s.contains(",")) {
            return dateResolver.resolve(s, FilterOperator.EQ, now).range();
        }
        List<String> bounds = bounds(condition);
        Instant start = dateResolver.resolve(bounds.get(0), now).lowerBound();
        Instant end = dateResolver.resolve(bounds.get(1), now).upperBound();
        if (start.isAfter(end)) {
            throw new ValidationException("filter.invalidRange", List.of("value"),
                    "Range start " + bounds.get(0) + " is after end " + bounds.get(1), null);
        }
        return new DateRange(start, end);
    }

    private static List<String> bounds(FilterCondition condition) {
        Object value = condition.getValue();
        List<String> bounds;
        if (value instanceof Collection<?> collection) {
            bounds = collection.stream().map(v -> v == null ? "" : String.valueOf(v).trim()).toList();
        } else {
            bounds = Arrays.stream(String.valueOf(value).split(",")).map(String::trim).toList();
        }
        if (bounds.size() < 2 || bounds.get(0).isEmpty() || bounds.get(1).isEmpty()) {
            throw new ValidationException("filter.invalidRange", List.of("value"),
                    "Range operator '" + condition.getOperator() + "' requires two bounds", null);
        }
        return bounds.subList(0, 2);
    }

    private static List<String> listValues(FilterCondition condition) {
        Object value = condition.getValue();
        List<String> values;
        if (value instanceof Collection<?> collection) {
            values = collection.stream()
                    .filter(v -> v != null)
                    .map(String::valueOf)
                    .toList();
        } else {
            values = Arrays.stream(String.valueOf(value).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
        if (values.isEmpty()) {
            throw new ValidationException("filter.valueRequired", List.of("value"),
                    "Operator '" + condition.getOperator() + "' requires at least one value", null);
        }
        return values;
    }

    private static String scalar(FilterCondition condition) {
        Object value = condition.getValue();
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            throw new ValidationException("filter.invalidValue", List.of("value"),
                    "Operator '" + condition.getOperator() + "' expects a single value", null);
        }
        return String.valueOf(value);
    }

    private static BigDecimal number(Object value) {
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("filter.invalidNumber", List.of("value"),
                    "Invalid numeric value: " + value, null);
        }
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "t", "1", "yes" -> true;
            case "false", "f", "0", "no" -> false;
            default -> throw new ValidationException("filter.invalidBoolean", List.of("value"),
                    "Invalid boolean value: " + value, null);
        };
    }

    /**
     * {@code "status:active"} becomes {@code {"status":"active"}}. Numbers and null are typed,
     * anything else stays a string.
     */
    private static String keyEqualsJson(String value) {
        int separator = value.indexOf(':');
        if (separator <= 0) {
            throw new ValidationException("filter.invalidValue", List.of("value"),
                    "keyEquals expects 'key:value', got: " + value, null);
        }
        String key = value.substring(0, separator).trim();
        String raw = value.substring(separator + 1).trim();

        Object typed;
        if (raw.equals("null")) {
            typed = null;
        } else {
            typed = parseNumber(raw).orElse(raw);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(key, typed);
        try {
            return JSON.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ValidationException("filter.invalidValue", List.of("value"),
                    "Unable to encode keyEquals value: " + value, null);
        }
    }

    private static Optional<Object> parseNumber(String raw) {
        try {
            return Optional.of(new BigDecimal(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * {@code $.address.city} becomes the Postgres path literal {@code {address,city}}.
     */
    private static String jsonPath(String value) {
        String path = value.trim();
        if (path.startsWith("$.")) {
            path = path.substring(2);
        } else if (path.startsWith("$")) {
            path = path.substring(1);
        }
        List<String> parts = Arrays.stream(path.split("\\."))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
        if (parts.isEmpty()) {
            throw new ValidationException("filter.invalidValue", List.of("value"), "Empty JSON path: " + value, null);
        }
        return "{" + String.join(",", parts) + "}";
    }

    private String aggregateTarget(String column) {
        Matcher call = AGGREGATE_CALL.matcher(column.trim());
        if (call.matches()) {
            String argument = call.group(2).equals("*") ? "*" : quoting.quoteIdentifier(call.group(2));
            return call.group(1).toUpperCase(Locale.ROOT) + "(" + argument + ")";
        }
        return quoting.quoteIdentifier(column.trim());
    }

    private static String comparison(FilterOperator operator) {
        return switch (operator) {
            case EQ -> "=";
            case NEQ -> "!=";
            case LT -> "<";
            case LTE -> "<=";
            case GT -> ">";
            case GTE -> ">=";
            default -> throw new IllegalStateException("Not a comparison operator: " + operator);
        };
    }

    private static String membership(FilterOperator operator) {
        return operator == FilterOperator.IN ? " IN (" : " NOT IN (";
    }

    private static ValidationException unsupported(FilterCondition condition, String category) {
        return new ValidationException("filter.operatorNotAllowed", List.of("operator"),
                "Operator '" + condition.getOperator() + "' is not supported for " + category + " columns", null);
    }

    private static CompiledPredicate predicate(FilterCondition condition, FilterOperator operator,
                                               String sql, List<Object> values) {
        return new CompiledPredicate(condition.getColumn(), operator, sql, values, condition.getLogicalOperator());
    }

    @FunctionalInterface
    private interface PredicateSupplier {
        CompiledPredicate get();
    }
}
