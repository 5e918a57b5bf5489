package org.carball.widgetq.model.filter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record DateRange(Instant start, Instant end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
