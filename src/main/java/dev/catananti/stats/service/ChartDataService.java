package dev.catananti.stats.service;

import dev.catananti.stats.dto.ChartData;
import dev.catananti.stats.dto.SelectedDataPoints;
import dev.catananti.stats.dto.SiteMetricsResponse;
import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.util.DataPoints;
import dev.catananti.stats.util.NearestPointSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Builds {@link ChartData} for a metric by pairing a period with the one immediately before it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartDataService {

    private final StatsDataService statsDataService;

    public Mono<ChartData> getChartData(SiteMetric metric, DateInterval interval, Granularity granularity) {
        ZoneId zone = statsDataService.getSiteZone();
        DateInterval comparison = comparisonInterval(interval, granularity, zone);
        log.debug("Building chart for {} {} ({}), comparing with {}", metric, interval, granularity, comparison);
        return Mono.zip(
                        statsDataService.getSiteStats(interval, granularity),
                        statsDataService.getSiteStats(comparison, granularity))
                .map(tuple -> toChartData(metric, granularity, interval, comparison,
                        tuple.getT1(), tuple.getT2(), zone));
    }

    /**
     * Resolves the current and previous points under {@code probe}.
     */
    public Mono<SelectedDataPoints> getSelection(SiteMetric metric, DateInterval interval,
                                                 Granularity granularity, Instant probe) {
        return getChartData(metric, interval, granularity)
                .map(chartData -> NearestPointSelector.select(probe, chartData, statsDataService.getSiteZone()));
    }

    /**
     * The interval of equal length ending where {@code interval} starts. Intervals aligned on
     * granularity buckets are shifted by whole calendar buckets, so a month compares with the
     * previous month whatever their lengths.
     */
    static DateInterval comparisonInterval(DateInterval interval, Granularity granularity, ZoneId zone) {
        boolean aligned = granularity.bucketStart(interval.start(), zone).equals(interval.start())
                && granularity.bucketStart(interval.end(), zone).equals(interval.end());
        long buckets = granularity.bucketsBetween(interval.start(), interval.end(), zone);
        if (aligned && buckets > 0) {
            return new DateInterval(granularity.shift(interval.start(), -buckets, zone), interval.start());
        }
        return new DateInterval(interval.start().minus(interval.duration()), interval.start());
    }

    private static ChartData toChartData(SiteMetric metric, Granularity granularity,
                                         DateInterval current, DateInterval comparison,
                                         SiteMetricsResponse currentResponse, SiteMetricsResponse previousResponse,
                                         ZoneId zone) {
        List<DataPoint> currentSeries = currentResponse.seriesOf(metric);
        List<DataPoint> previousSeries = previousResponse.seriesOf(metric);
        List<DataPoint> mapped = DataPoints.mapPreviousSeries(previousSeries, current, comparison, granularity, zone);
        return new ChartData(metric, granularity,
                currentResponse.total().get(metric).orElse(0),
                currentSeries,
                previousResponse.total().get(metric).orElse(0),
                previousSeries,
                mapped,
                DataPoints.previousOffset(current, comparison, granularity, zone));
    }
}
