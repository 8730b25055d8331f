package dev.catananti.stats.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Site traffic metrics.
 * {@code wireKey} is the field name used by the remote visits endpoint; metrics without a
 * wire key are never reported in time series.
 */
@Getter
@RequiredArgsConstructor
public enum SiteMetric implements MetricType {
    VIEWS("views", AggregationStrategy.SUM),
    VISITORS("visitors", AggregationStrategy.SUM),
    LIKES("likes", AggregationStrategy.SUM),
    COMMENTS("comments", AggregationStrategy.SUM),
    POSTS("posts", AggregationStrategy.SUM),
    TIME_ON_SITE(null, AggregationStrategy.AVERAGE),
    BOUNCE_RATE(null, AggregationStrategy.AVERAGE),
    DOWNLOADS(null, AggregationStrategy.SUM);

    private final String wireKey;
    private final AggregationStrategy aggregationStrategy;

    public boolean isSeriesMetric() {
        return wireKey != null;
    }
}
