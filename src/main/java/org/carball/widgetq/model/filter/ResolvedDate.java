package org.carball.widgetq.model.filter;

import java.time.Instant;

/**
 * Result of resolving a date value: either an exact instant or a range.
 */
public record ResolvedDate(Instant instant, DateRange range) {

    public static ResolvedDate of(Instant instant) {
        return new ResolvedDate(instant, null);
    }

    public static ResolvedDate of(DateRange range) {
        return new ResolvedDate(null, range);
    }

    public boolean isRange() {
        return range != null;
    }

    public Instant lowerBound() {
        return isRange() ? range.start() : instant;
    }

    public Instant upperBound() {
        return isRange() ? range.end() : instant;
    }
}
