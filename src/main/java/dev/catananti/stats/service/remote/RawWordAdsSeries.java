package dev.catananti.stats.service.remote;

import java.time.Instant;
import java.util.List;

/**
 * WordAds periods; {@code cpm} and {@code revenue} are in dollars.
 */
public record RawWordAdsSeries(List<Period> periods) {

    public RawWordAdsSeries {
        periods = List.copyOf(periods);
    }

    public record Period(Instant date, long impressions, double cpm, double revenue) {
    }
}
