package org.carball.widgetq.model.filter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named ranges accepted after the {@code __rel_date:} prefix.
 */
public enum RelativeDateOption {
    TODAY("today"),
    YESTERDAY("yesterday"),
    TOMORROW("tomorrow"),
    THIS_WEEK("thisWeek"),
    LAST_WEEK("lastWeek"),
    NEXT_WEEK("nextWeek"),
    THIS_MONTH("thisMonth"),
    LAST_MONTH("lastMonth"),
    NEXT_MONTH("nextMonth"),
    LAST_7_DAYS("last7Days"),
    NEXT_7_DAYS("next7Days"),
    LAST_30_DAYS("last30Days"),
    NEXT_30_DAYS("next30Days"),
    THIS_YEAR("thisYear"),
    LAST_YEAR("lastYear"),
    CUSTOM("custom");

    private final String key;

    RelativeDateOption(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<RelativeDateOption> fromKey(String key) {
        return Arrays.stream(values())
                .filter(option -> option.key.equals(key))
                .findFirst();
    }
}
