package dev.catananti.stats.util;

import dev.catananti.stats.entity.AggregationStrategy;
import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.Granularity;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers over time series of {@link DataPoint}.
 */
public final class DataPoints {

    private DataPoints() {}

    /**
     * Total of a series under the metric's aggregation strategy; {@code null} for an empty series.
     * Averages use integer division.
     */
    public static Integer totalValue(List<DataPoint> points, AggregationStrategy strategy) {
        if (points.isEmpty()) {
            return null;
        }
        long sum = 0;
        for (DataPoint point : points) {
            sum += point.value();
        }
        return switch (strategy) {
            case SUM -> saturatedInt(sum);
            case AVERAGE -> saturatedInt(sum / points.size());
        };
    }

    /**
     * Narrows {@code value} to an int, clamping at the int bounds instead of wrapping.
     */
    public static int saturatedInt(long value) {
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }

    /**
     * Re-dates points of the comparison period onto the current period's axis by the whole-bucket
     * offset between the two interval starts, keeping only points that land inside {@code current}.
     */
    public static List<DataPoint> mapPreviousSeries(List<DataPoint> previous,
                                                    DateInterval current,
                                                    DateInterval comparison,
                                                    Granularity granularity,
                                                    ZoneId zone) {
        long offset = previousOffset(current, comparison, granularity, zone);
        List<DataPoint> mapped = new ArrayList<>(previous.size());
        for (DataPoint point : previous) {
            DataPoint shifted = point.withDate(granularity.shift(point.date(), offset, zone));
            if (current.contains(shifted.date())) {
                mapped.add(shifted);
            }
        }
        return mapped;
    }

    /**
     * Whole buckets between the comparison and current interval starts; shifting a comparison
     * point by this amount puts it on the current axis, shifting back by its negation undoes it.
     */
    public static long previousOffset(DateInterval current,
                                      DateInterval comparison,
                                      Granularity granularity,
                                      ZoneId zone) {
        return granularity.bucketsBetween(comparison.start(), current.start(), zone);
    }
}
