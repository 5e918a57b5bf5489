package org.carball.widgetq.model.filter;

import java.util.List;

/**
 * A filter after operator and date resolution. {@code sql} is ready for a WHERE or HAVING clause;
 * {@code values} carries the resolved operands for consumers that do not speak SQL.
 */
public record CompiledPredicate(String column,
                                FilterOperator operator,
                                String sql,
                                List<Object> values,
                                LogicalOperator logicalOperator) {

    public CompiledPredicate {
        values = values == null ? List.of() : List.copyOf(values);
        logicalOperator = logicalOperator == null ? LogicalOperator.AND : logicalOperator;
    }
}
