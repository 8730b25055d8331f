package dev.catananti.stats.util;

import dev.catananti.stats.dto.ChartData;
import dev.catananti.stats.dto.SelectedDataPoints;
import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.SiteMetric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NearestPointSelector")
class NearestPointSelectorTest {

    private static final ZoneId SITE = ZoneId.of("Europe/Lisbon");

    private static Instant day(int month, int day) {
        return LocalDate.of(2025, month, day).atStartOfDay(SITE).toInstant();
    }

    private static ChartData chart(List<DataPoint> current, List<DataPoint> previous, List<DataPoint> mapped) {
        return new ChartData(SiteMetric.VIEWS, Granularity.DAY, 0, current, 0, previous, mapped, 7);
    }

    private static Instant day(int year, int month, int day) {
        return LocalDate.of(year, month, day).atStartOfDay(SITE).toInstant();
    }

    @Test
    @DisplayName("should resolve any time of day to that day's point")
    void probeInsideBucket_shouldResolveToBucketPoint() {
        List<DataPoint> current = List.of(
                new DataPoint(day(1, 1), 10), new DataPoint(day(1, 2), 20), new DataPoint(day(1, 3), 30));
        ChartData data = chart(current, List.of(), List.of());

        Instant lateDay2 = LocalDateTime.of(2025, 1, 2, 22, 15).atZone(SITE).toInstant();
        Instant earlyDay2 = LocalDateTime.of(2025, 1, 2, 0, 1).atZone(SITE).toInstant();

        assertThat(NearestPointSelector.select(lateDay2, data, SITE).current()).isEqualTo(current.get(1));
        assertThat(NearestPointSelector.select(earlyDay2, data, SITE).current()).isEqualTo(current.get(1));
    }

    @Test
    @DisplayName("should return null for a day without data")
    void probeOutsideData_shouldBeNull() {
        List<DataPoint> current = List.of(
                new DataPoint(day(1, 1), 10), new DataPoint(day(1, 2), 20), new DataPoint(day(1, 3), 30));

        SelectedDataPoints selected = NearestPointSelector.select(day(1, 4), chart(current, List.of(), List.of()), SITE);

        assertThat(selected.current()).isNull();
        assertThat(selected.previous()).isNull();
    }

    @Test
    @DisplayName("should match previous on the mapped series and report the unmapped point")
    void previous_shouldUseMappedForMatching() {
        List<DataPoint> current = List.of(new DataPoint(day(1, 8), 1), new DataPoint(day(1, 9), 2));
        List<DataPoint> previous = List.of(new DataPoint(day(1, 1), 5), new DataPoint(day(1, 2), 6));
        List<DataPoint> mapped = List.of(new DataPoint(day(1, 8), 5), new DataPoint(day(1, 9), 6));

        SelectedDataPoints selected = NearestPointSelector.select(day(1, 9), chart(current, previous, mapped), SITE);

        assertThat(selected.current()).isEqualTo(new DataPoint(day(1, 9), 2));
        assertThat(selected.previous()).isEqualTo(new DataPoint(day(1, 9), 6));
        assertThat(selected.unmappedPrevious()).isEqualTo(new DataPoint(day(1, 2), 6));
    }

    @Test
    @DisplayName("should return only the previous point when the current period has no data there")
    void onlyPrevious() {
        List<DataPoint> current = List.of(new DataPoint(day(1, 8), 1));
        List<DataPoint> previous = List.of(new DataPoint(day(1, 1), 5), new DataPoint(day(1, 2), 6));
        List<DataPoint> mapped = List.of(new DataPoint(day(1, 8), 5), new DataPoint(day(1, 9), 6));

        SelectedDataPoints selected = NearestPointSelector.select(day(1, 9), chart(current, previous, mapped), SITE);

        assertThat(selected.current()).isNull();
        assertThat(selected.previous()).isEqualTo(new DataPoint(day(1, 9), 6));
    }

    @Test
    @DisplayName("should report the raw point the mapped point came from when leading points were dropped")
    void droppedLeadingPoint_shouldPairUnmappedBySourceBucket() {
        DateInterval current = new DateInterval(day(2025, 1, 8), day(2025, 1, 22));
        DateInterval comparison = new DateInterval(day(2024, 12, 25), day(2025, 1, 8));
        List<DataPoint> previous = List.of(
                new DataPoint(day(2024, 12, 23), 1),
                new DataPoint(day(2024, 12, 30), 2),
                new DataPoint(day(2025, 1, 6), 3));
        List<DataPoint> mapped = DataPoints.mapPreviousSeries(previous, current, comparison, Granularity.WEEK, SITE);
        ChartData data = new ChartData(SiteMetric.VIEWS, Granularity.WEEK, 0, List.of(), 6, previous, mapped,
                DataPoints.previousOffset(current, comparison, Granularity.WEEK, SITE));

        SelectedDataPoints selected = NearestPointSelector.select(day(2025, 1, 14), data, SITE);

        assertThat(mapped).containsExactly(new DataPoint(day(2025, 1, 13), 2), new DataPoint(day(2025, 1, 20), 3));
        assertThat(selected.previous()).isEqualTo(new DataPoint(day(2025, 1, 13), 2));
        assertThat(selected.unmappedPrevious()).isEqualTo(new DataPoint(day(2024, 12, 30), 2));
    }

    @Test
    @DisplayName("should return nothing for empty series")
    void emptySeries() {
        SelectedDataPoints selected = NearestPointSelector.select(day(1, 1), chart(List.of(), List.of(), List.of()), SITE);

        assertThat(selected.isEmpty()).isTrue();
        assertThat(selected.unmappedPrevious()).isNull();
    }
}
