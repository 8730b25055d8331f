package dev.catananti.stats.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * WordAds earnings metrics. CPM and revenue values are stored in cents.
 */
@Getter
@RequiredArgsConstructor
public enum WordAdsMetric implements MetricType {
    IMPRESSIONS(AggregationStrategy.SUM),
    CPM(AggregationStrategy.AVERAGE),
    REVENUE(AggregationStrategy.SUM);

    private final AggregationStrategy aggregationStrategy;
}
