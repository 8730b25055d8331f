package dev.catananti.stats.entity;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open date range {@code [start, end)}.
 */
public record DateInterval(Instant start, Instant end) {

    public DateInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
