package org.carball.widgetq.filter;

import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.schema.DataTypeCategory;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.carball.widgetq.model.filter.FilterOperator.*;

/**
 * Legal filter operators per column data type.
 */
public final class OperatorCatalog {

    private static final List<FilterOperator> TEXT_OPERATORS = List.of(
            EQ, NEQ, CONTAINS, STARTS_WITH, ENDS_WITH, IN, NOT_IN, IS_NULL, NOT_NULL);

    private static final List<FilterOperator> NUMERIC_OPERATORS = List.of(
            EQ, NEQ, LT, LTE, GT, GTE, BETWEEN, NOT_BETWEEN, IN, NOT_IN, IS_NULL, NOT_NULL);

    private static final List<FilterOperator> BOOLEAN_OPERATORS = List.of(EQ, IS_NULL, NOT_NULL);

    private static final List<FilterOperator> DATE_OPERATORS = List.of(
            EQ, NEQ, BEFORE, BEFORE_OR_ON, AFTER, AFTER_OR_ON, DURING, BETWEEN, NOT_BETWEEN,
            IS_NULL, NOT_NULL);

    private static final List<FilterOperator> IDENTIFIER_OPERATORS = List.of(
            EQ, NEQ, IN, NOT_IN, IS_NULL, NOT_NULL);

    private static final List<FilterOperator> JSON_OPERATORS = List.of(
            CONTAINS_TEXT, HAS_KEY, KEY_EQUALS, PATH_EXISTS, IS_NULL, NOT_NULL);

    private static final List<FilterOperator> DEFAULT_OPERATORS = List.of(EQ, NEQ, IS_NULL, NOT_NULL);

    private static final Set<FilterOperator> RANGE_OPERATORS = EnumSet.of(BETWEEN, NOT_BETWEEN, DURING);

    private static final Map<FilterOperator, FilterOperator> DATE_OPERATOR_MAPPING = Map.of(
            BEFORE, LT,
            BEFORE_OR_ON, LTE,
            AFTER, GT,
            AFTER_OR_ON, GTE,
            DURING, EQ);

    private OperatorCatalog() {
        // Utility class - prevent instantiation
    }

    public static List<FilterOperator> operatorsFor(String dataType) {
        return operatorsFor(DataTypeCategory.of(dataType));
    }

    public static List<FilterOperator> operatorsFor(DataTypeCategory category) {
        return switch (category) {
            case TEXT -> TEXT_OPERATORS;
            case NUMERIC -> NUMERIC_OPERATORS;
            case BOOLEAN -> BOOLEAN_OPERATORS;
            case DATE -> DATE_OPERATORS;
            case UUID, ENUM -> IDENTIFIER_OPERATORS;
            case JSON -> JSON_OPERATORS;
            case UNKNOWN -> DEFAULT_OPERATORS;
        };
    }

    public static boolean isRangeOperator(FilterOperator operator) {
        return operator != null && RANGE_OPERATORS.contains(operator);
    }

    public static boolean isDateOperator(FilterOperator operator) {
        return operator != null && DATE_OPERATOR_MAPPING.containsKey(operator);
    }

    /**
     * Rewrites a date-domain operator onto the comparison domain. Other operators map to themselves.
     */
    public static FilterOperator mapDateOperator(FilterOperator operator) {
        if (operator == null) {
            return null;
        }
        return DATE_OPERATOR_MAPPING.getOrDefault(operator, operator);
    }

    /**
     * Date columns also accept the comparison operators that their date operators map onto.
     */
    public static boolean isLegal(String dataType, FilterOperator operator) {
        if (operator == null) {
            return false;
        }
        DataTypeCategory category = DataTypeCategory.of(dataType);
        if (operatorsFor(category).contains(operator)) {
            return true;
        }
        return category.isDate() && DATE_OPERATOR_MAPPING.containsValue(operator);
    }
}
