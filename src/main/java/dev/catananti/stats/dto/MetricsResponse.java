package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DataPoint;

import java.util.List;
import java.util.Map;

/**
 * Totals and per-metric time series of one metric family.
 *
 * @param <M> metric enum of the family
 */
public interface MetricsResponse<M extends Enum<M>> {

    MetricSet<M> total();

    Map<M, List<DataPoint>> series();

    default List<DataPoint> seriesOf(M metric) {
        return series().getOrDefault(metric, List.of());
    }
}
