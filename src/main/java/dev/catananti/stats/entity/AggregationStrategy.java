package dev.catananti.stats.entity;

/**
 * How a metric's per-period values combine into a single total.
 */
public enum AggregationStrategy {
    SUM,
    AVERAGE
}
