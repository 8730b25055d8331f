package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.SiteMetric;

import java.util.List;
import java.util.Map;

public record SiteMetricsResponse(MetricSet<SiteMetric> total,
                                  Map<SiteMetric, List<DataPoint>> series) implements MetricsResponse<SiteMetric> {

    public SiteMetricsResponse {
        series = Map.copyOf(series);
    }

    public SiteMetricsResponse withTotal(MetricSet<SiteMetric> newTotal) {
        return new SiteMetricsResponse(newTotal, series);
    }
}
