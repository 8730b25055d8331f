package dev.catananti.stats.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from a metric enum to an optional integer value.
 * An absent metric is distinct from a metric whose value is zero.
 *
 * @param <M> metric enum
 */
public final class MetricSet<M extends Enum<M>> {

    private final Class<M> metricType;
    private final Map<M, Integer> values;

    private MetricSet(Class<M> metricType, EnumMap<M, Integer> values) {
        this.metricType = metricType;
        this.values = Collections.unmodifiableMap(values);
    }

    public static <M extends Enum<M>> MetricSet<M> empty(Class<M> metricType) {
        return new MetricSet<>(metricType, new EnumMap<>(metricType));
    }

    public static <M extends Enum<M>> MetricSet<M> of(Class<M> metricType, Map<M, Integer> values) {
        EnumMap<M, Integer> copy = new EnumMap<>(metricType);
        values.forEach((metric, value) -> {
            if (value != null) {
                copy.put(metric, value);
            }
        });
        return new MetricSet<>(metricType, copy);
    }

    public static <M extends Enum<M>> MetricSet<M> of(M metric, int value) {
        return empty(metric.getDeclaringClass()).with(metric, value);
    }

    public Optional<Integer> get(M metric) {
        return Optional.ofNullable(values.get(metric));
    }

    /**
     * Value of {@code metric}, or {@code null} when absent.
     */
    public Integer valueOf(M metric) {
        return values.get(metric);
    }

    public boolean contains(M metric) {
        return values.containsKey(metric);
    }

    /**
     * Copy of this set with {@code metric} set to {@code value}; a {@code null} value removes the metric.
     */
    public MetricSet<M> with(M metric, Integer value) {
        EnumMap<M, Integer> copy = new EnumMap<>(metricType);
        copy.putAll(values);
        if (value == null) {
            copy.remove(metric);
        } else {
            copy.put(metric, value);
        }
        return new MetricSet<>(metricType, copy);
    }

    @JsonValue
    public Map<M, Integer> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricSet<?> other)) return false;
        return metricType.equals(other.metricType) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricType, values);
    }

    @Override
    public String toString() {
        return "MetricSet" + values;
    }
}
