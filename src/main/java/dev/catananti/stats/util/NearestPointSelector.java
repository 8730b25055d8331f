package dev.catananti.stats.util;

import dev.catananti.stats.dto.ChartData;
import dev.catananti.stats.dto.SelectedDataPoints;
import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.Granularity;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Resolves the data points under a probe date (cursor or tooltip position).
 * <p>
 * Matching is bucket-aligned: the probe and every point are reduced to the start of their
 * granularity bucket in the site zone, so any probe inside a bucket selects that bucket's point.
 * The previous series is matched on its current-axis (mapped) copy; the unmapped point reported
 * alongside it is the raw previous point whose bucket the mapped point was shifted from.
 */
public final class NearestPointSelector {

    private NearestPointSelector() {}

    public static SelectedDataPoints select(Instant probe, ChartData chartData, ZoneId siteZone) {
        Granularity granularity = chartData.getGranularity();
        Instant bucket = granularity.bucketStart(probe, siteZone);

        int currentIndex = indexOfBucket(chartData.getCurrentSeries(), bucket, granularity, siteZone);
        DataPoint current = currentIndex >= 0 ? chartData.getCurrentSeries().get(currentIndex) : null;

        List<DataPoint> mapped = chartData.getMappedPreviousSeries();
        int previousIndex = indexOfBucket(mapped, bucket, granularity, siteZone);
        if (previousIndex < 0) {
            return new SelectedDataPoints(current, null, null);
        }
        DataPoint previous = mapped.get(previousIndex);
        Instant sourceBucket = granularity.bucketStart(
                granularity.shift(previous.date(), -chartData.getPreviousOffset(), siteZone), siteZone);
        List<DataPoint> unmapped = chartData.getPreviousSeries();
        int unmappedIndex = indexOfBucket(unmapped, sourceBucket, granularity, siteZone);
        DataPoint unmappedPrevious = unmappedIndex >= 0 ? unmapped.get(unmappedIndex) : null;
        return new SelectedDataPoints(current, previous, unmappedPrevious);
    }

    private static int indexOfBucket(List<DataPoint> series, Instant bucket, Granularity granularity, ZoneId zone) {
        for (int i = 0; i < series.size(); i++) {
            if (granularity.bucketStart(series.get(i).date(), zone).equals(bucket)) {
                return i;
            }
        }
        return -1;
    }
}
