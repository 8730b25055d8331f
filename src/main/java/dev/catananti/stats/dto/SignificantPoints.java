package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DataPoint;

/**
 * Extremes of the current and (mapped) previous series. Minima ignore zero values; any field may be null.
 */
public record SignificantPoints(DataPoint currentMax,
                                DataPoint currentMin,
                                DataPoint previousMax,
                                DataPoint previousMin) {
}
