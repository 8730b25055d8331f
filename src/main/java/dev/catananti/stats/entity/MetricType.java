package dev.catananti.stats.entity;

/**
 * Common contract of the metric enums ({@link SiteMetric}, {@link WordAdsMetric}).
 */
public interface MetricType {

    AggregationStrategy getAggregationStrategy();
}
