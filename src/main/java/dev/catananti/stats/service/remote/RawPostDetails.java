package dev.catananti.stats.service.remote;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Lifetime stats of a single post. {@code views} are daily, dated at local-zone midnight.
 */
public record RawPostDetails(String postTitle,
                             String postUrl,
                             Integer totalViews,
                             Integer highestMonth,
                             Integer highestDayAverage,
                             Integer highestWeekAverage,
                             Map<Integer, Integer> yearlyTotals,
                             List<Period> views) {

    public RawPostDetails {
        yearlyTotals = Map.copyOf(yearlyTotals);
        views = List.copyOf(views);
    }

    public record Period(Instant date, int views) {
    }
}
