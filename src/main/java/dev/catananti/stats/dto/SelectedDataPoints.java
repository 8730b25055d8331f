package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DataPoint;

/**
 * Points resolved for a probe date.
 *
 * @param current          point of the current series, or null
 * @param previous         point of the previous series re-dated onto the current axis, or null
 * @param unmappedPrevious the same previous point with its original date, or null
 */
public record SelectedDataPoints(DataPoint current, DataPoint previous, DataPoint unmappedPrevious) {

    public static SelectedDataPoints none() {
        return new SelectedDataPoints(null, null, null);
    }

    public boolean isEmpty() {
        return current == null && previous == null;
    }
}
