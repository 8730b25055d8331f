package dev.catananti.stats.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * A single value of a time series. {@code date} is the start of the bucket in the site's time zone.
 */
public record DataPoint(Instant date, int value) {

    public DataPoint {
        Objects.requireNonNull(date, "date");
    }

    public DataPoint withDate(Instant newDate) {
        return new DataPoint(newDate, value);
    }
}
