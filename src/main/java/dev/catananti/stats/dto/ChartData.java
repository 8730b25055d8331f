package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.SiteMetric;
import lombok.Getter;

import java.util.List;

/**
 * Chart-ready view of one metric over a current and a comparison period.
 * Derived values are computed once on construction; instances are immutable.
 */
@Getter
public final class ChartData {

    private final SiteMetric metric;
    private final Granularity granularity;
    private final int currentTotal;
    private final List<DataPoint> currentSeries;
    private final int previousTotal;
    private final List<DataPoint> previousSeries;
    private final List<DataPoint> mappedPreviousSeries;
    /** Whole granularity buckets the previous series was moved forward by when mapped. */
    private final long previousOffset;
    private final int maxValue;
    private final SignificantPoints significantPoints;
    private final boolean emptyOrZero;

    public ChartData(SiteMetric metric,
                     Granularity granularity,
                     int currentTotal,
                     List<DataPoint> currentSeries,
                     int previousTotal,
                     List<DataPoint> previousSeries,
                     List<DataPoint> mappedPreviousSeries,
                     long previousOffset) {
        this.metric = metric;
        this.granularity = granularity;
        this.currentTotal = currentTotal;
        this.currentSeries = List.copyOf(currentSeries);
        this.previousTotal = previousTotal;
        this.previousSeries = List.copyOf(previousSeries);
        this.mappedPreviousSeries = List.copyOf(mappedPreviousSeries);
        this.previousOffset = previousOffset;
        this.maxValue = Math.max(maxOf(this.currentSeries), maxOf(this.mappedPreviousSeries));
        this.significantPoints = new SignificantPoints(
                findPositiveMax(this.currentSeries),
                findPositiveMin(this.currentSeries),
                findMax(this.mappedPreviousSeries),
                findPositiveMin(this.mappedPreviousSeries));
        this.emptyOrZero = allZero(this.currentSeries) && allZero(this.previousSeries);
    }

    /**
     * True when neither period has any data point.
     */
    public boolean isEmpty() {
        return currentSeries.isEmpty() && previousSeries.isEmpty();
    }

    private static int maxOf(List<DataPoint> series) {
        int max = 0;
        for (DataPoint point : series) {
            max = Math.max(max, point.value());
        }
        return max;
    }

    // Zero never counts as the current maximum; ties resolve to the earliest point.
    private static DataPoint findPositiveMax(List<DataPoint> series) {
        DataPoint max = null;
        int maxValue = 0;
        for (DataPoint point : series) {
            if (point.value() > maxValue) {
                max = point;
                maxValue = point.value();
            }
        }
        return max;
    }

    // Ties resolve to the earliest point.
    private static DataPoint findMax(List<DataPoint> series) {
        DataPoint max = null;
        for (DataPoint point : series) {
            if (max == null || point.value() > max.value()) {
                max = point;
            }
        }
        return max;
    }

    private static DataPoint findPositiveMin(List<DataPoint> series) {
        DataPoint min = null;
        for (DataPoint point : series) {
            if (point.value() > 0 && (min == null || point.value() < min.value())) {
                min = point;
            }
        }
        return min;
    }

    private static boolean allZero(List<DataPoint> series) {
        for (DataPoint point : series) {
            if (point.value() != 0) {
                return false;
            }
        }
        return true;
    }
}
