package dev.catananti.stats.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Time bucket sizes, declared from finest to coarsest.
 * Weeks start on Monday.
 */
@Getter
@RequiredArgsConstructor
public enum Granularity {
    HOUR(ChronoUnit.HOURS, 24),
    DAY(ChronoUnit.DAYS, 7),
    WEEK(ChronoUnit.WEEKS, 12),
    MONTH(ChronoUnit.MONTHS, 12),
    YEAR(ChronoUnit.YEARS, 6);

    private final ChronoUnit unit;
    private final int preferredQuantity;

    public boolean isCoarserThan(Granularity other) {
        return compareTo(other) > 0;
    }

    public ZonedDateTime bucketStart(ZonedDateTime dateTime) {
        return switch (this) {
            case HOUR -> dateTime.truncatedTo(ChronoUnit.HOURS);
            case DAY -> dateTime.toLocalDate().atStartOfDay(dateTime.getZone());
            case WEEK -> dateTime.toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .atStartOfDay(dateTime.getZone());
            case MONTH -> dateTime.toLocalDate().withDayOfMonth(1).atStartOfDay(dateTime.getZone());
            case YEAR -> dateTime.toLocalDate().withDayOfYear(1).atStartOfDay(dateTime.getZone());
        };
    }

    public Instant bucketStart(Instant instant, ZoneId zone) {
        return bucketStart(instant.atZone(zone)).toInstant();
    }

    public Instant bucketEnd(Instant instant, ZoneId zone) {
        return bucketStart(instant.atZone(zone)).plus(1, unit).toInstant();
    }

    /**
     * Moves {@code instant} by {@code amount} buckets using calendar arithmetic in {@code zone}.
     */
    public Instant shift(Instant instant, long amount, ZoneId zone) {
        return instant.atZone(zone).plus(amount, unit).toInstant();
    }

    /**
     * Number of whole buckets between the buckets containing {@code from} and {@code to}.
     */
    public long bucketsBetween(Instant from, Instant to, ZoneId zone) {
        return unit.between(bucketStart(from.atZone(zone)), bucketStart(to.atZone(zone)));
    }
}
