package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DataPoint;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lifetime stats of one post; {@code dailyViews} are dated in the site zone and
 * {@code yearlyTotals} iterate in ascending year order.
 */
public record PostDetailsResponse(long postId,
                                  String title,
                                  String url,
                                  int totalViews,
                                  Integer highestMonth,
                                  Integer highestDayAverage,
                                  Integer highestWeekAverage,
                                  Map<Integer, Integer> yearlyTotals,
                                  List<DataPoint> dailyViews) {

    public PostDetailsResponse {
        yearlyTotals = Collections.unmodifiableMap(new TreeMap<>(yearlyTotals));
        dailyViews = List.copyOf(dailyViews);
    }
}
