package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.WordAdsMetric;

import java.util.List;
import java.util.Map;

/**
 * WordAds totals and series; {@link WordAdsMetric#CPM} and {@link WordAdsMetric#REVENUE} are in cents.
 */
public record WordAdsMetricsResponse(MetricSet<WordAdsMetric> total,
                                     Map<WordAdsMetric, List<DataPoint>> series) implements MetricsResponse<WordAdsMetric> {

    public WordAdsMetricsResponse {
        series = Map.copyOf(series);
    }
}
