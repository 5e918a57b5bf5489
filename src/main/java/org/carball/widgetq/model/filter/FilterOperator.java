package org.carball.widgetq.model.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum FilterOperator {
    EQ("eq"),
    NEQ("neq"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte"),
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    IN("in"),
    NOT_IN("notIn"),
    IS_NULL("isNull"),
    NOT_NULL("notNull"),
    BETWEEN("between"),
    NOT_BETWEEN("notBetween"),
    BEFORE("before"),
    BEFORE_OR_ON("beforeOrOn"),
    AFTER("after"),
    AFTER_OR_ON("afterOrOn"),
    DURING("during"),
    CONTAINS_TEXT("containsText"),
    HAS_KEY("hasKey"),
    KEY_EQUALS("keyEquals"),
    PATH_EXISTS("pathExists");

    private final String key;

    FilterOperator(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Resolves a wire key. Unknown keys resolve to {@code null} so a single bad condition
     * can be dropped instead of failing the whole filter list.
     */
    @JsonCreator
    public static FilterOperator fromKey(String key) {
        if (key == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(op -> op.key.equals(key))
                .findFirst()
                .orElse(null);
    }

    public boolean requiresValue() {
        return this != IS_NULL && this != NOT_NULL;
    }

    @Override
    public String toString() {
        return key;
    }
}
