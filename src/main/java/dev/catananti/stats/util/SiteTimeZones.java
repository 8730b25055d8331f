package dev.catananti.stats.util;

import dev.catananti.stats.entity.DateInterval;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Converts instants between a site's reporting time zone and the local zone the remote stats API
 * interprets dates in.
 * <p>
 * A conversion keeps the wall-clock time (year, month, day, hour, minute, second) and swaps the zone.
 * Sub-second precision is dropped. When the wall-clock time does not exist in the target zone
 * (a daylight-saving gap) the input is returned unchanged and a warning is logged.
 */
@Slf4j
public final class SiteTimeZones {

    private final ZoneId localZone;

    public SiteTimeZones(ZoneId localZone) {
        this.localZone = localZone;
    }

    public ZoneId getLocalZone() {
        return localZone;
    }

    /**
     * Reinterprets the wall-clock time of {@code date} in {@code siteZone} as a local-zone time.
     */
    public Instant toLocal(Instant date, ZoneId siteZone) {
        return convert(date, siteZone, localZone);
    }

    /**
     * Inverse of {@link #toLocal(Instant, ZoneId)}.
     */
    public Instant toSiteTimeZone(Instant date, ZoneId siteZone) {
        return convert(date, localZone, siteZone);
    }

    /**
     * Converts both bounds to the local zone and turns the exclusive end into an inclusive one
     * by stepping back one second.
     */
    public DateInterval normalizeInterval(DateInterval interval, ZoneId siteZone) {
        Instant start = toLocal(interval.start(), siteZone);
        Instant lastSecond = interval.end().minusSeconds(1);
        if (lastSecond.isBefore(interval.start())) {
            lastSecond = interval.start();
        }
        Instant end = toLocal(lastSecond, siteZone);
        return new DateInterval(start, end.isBefore(start) ? start : end);
    }

    /**
     * Whether {@code interval} overlaps the calendar day containing {@code now} in the site zone.
     */
    public boolean containsCurrentDate(DateInterval interval, ZoneId siteZone, Instant now) {
        LocalDate today = now.atZone(siteZone).toLocalDate();
        Instant startOfToday = today.atStartOfDay(siteZone).toInstant();
        Instant startOfTomorrow = today.plusDays(1).atStartOfDay(siteZone).toInstant();
        return interval.overlaps(startOfToday, startOfTomorrow);
    }

    public boolean isToday(Instant date, ZoneId siteZone, Instant now) {
        return date.atZone(siteZone).toLocalDate().equals(now.atZone(siteZone).toLocalDate());
    }

    private Instant convert(Instant date, ZoneId from, ZoneId to) {
        try {
            LocalDateTime wallClock = date.atZone(from).toLocalDateTime().truncatedTo(ChronoUnit.SECONDS);
            List<ZoneOffset> offsets = to.getRules().getValidOffsets(wallClock);
            if (offsets.isEmpty()) {
                log.warn("Wall-clock time {} does not exist in zone {}, keeping {}", wallClock, to, date);
                return date;
            }
            return ZonedDateTime.ofLocal(wallClock, to, offsets.get(0)).toInstant();
        } catch (DateTimeException e) {
            log.warn("Failed to convert {} from {} to {}: {}", date, from, to, e.getMessage());
            return date;
        }
    }
}
