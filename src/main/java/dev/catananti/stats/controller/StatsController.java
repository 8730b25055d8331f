package dev.catananti.stats.controller;

import dev.catananti.stats.dto.ChartData;
import dev.catananti.stats.dto.EmailOpensResponse;
import dev.catananti.stats.dto.PostDetailsResponse;
import dev.catananti.stats.dto.PostLikesResponse;
import dev.catananti.stats.dto.SelectedDataPoints;
import dev.catananti.stats.dto.SiteMetricsResponse;
import dev.catananti.stats.dto.TopListOptions;
import dev.catananti.stats.dto.TopListResponse;
import dev.catananti.stats.dto.WordAdsMetricsResponse;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.LocationLevel;
import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;
import dev.catananti.stats.entity.UtmParamGrouping;
import dev.catananti.stats.service.ChartDataService;
import dev.catananti.stats.service.StatsDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Read endpoints of the stats dashboard. Date ranges are given as site-local calendar days,
 * {@code end} inclusive.
 */
@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
@Validated
@Tag(name = "Stats", description = "Site analytics endpoints")
@Slf4j
public class StatsController {

    private final StatsDataService statsDataService;
    private final ChartDataService chartDataService;
    private final Clock clock;

    @GetMapping("/site")
    @Operation(summary = "Get site stats", description = "Totals and series for every site metric")
    public Mono<SiteMetricsResponse> getSiteStats(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "DAY") Granularity granularity) {
        log.debug("Fetching site stats {}..{} by {}", start, end, granularity);
        return Mono.defer(() -> statsDataService.getSiteStats(interval(start, end), granularity));
    }

    @GetMapping("/wordads")
    @Operation(summary = "Get WordAds stats", description = "Earnings for the preferred number of periods ending on the given date (default: today); CPM and revenue in cents")
    public Mono<WordAdsMetricsResponse> getWordAdsStats(
            @RequestParam(required = false) Instant date,
            @RequestParam(defaultValue = "DAY") Granularity granularity) {
        ZoneId zone = statsDataService.getSiteZone();
        Instant effectiveDate = date != null
                ? date
                : LocalDate.now(clock.withZone(zone)).atStartOfDay(zone).toInstant();
        log.debug("Fetching WordAds stats for {} by {}", effectiveDate, granularity);
        return statsDataService.getWordAdsStats(effectiveDate, granularity);
    }

    @GetMapping("/top/{item}")
    @Operation(summary = "Get top list", description = "Ranked items of a category for a date range")
    public Mono<TopListResponse> getTopList(
            @PathVariable TopListItemType item,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "VIEWS") SiteMetric metric,
            @RequestParam(defaultValue = "DAY") Granularity granularity,
            @RequestParam(defaultValue = "10") @Min(0) @Max(1000) int limit,
            @RequestParam(required = false) LocationLevel locationLevel,
            @RequestParam(required = false) DeviceBreakdown deviceBreakdown,
            @RequestParam(required = false) UtmParamGrouping utmGrouping) {
        log.debug("Fetching top list {} by {} for {}..{}, limit={}", item, metric, start, end, limit);
        TopListOptions options = TopListOptions.builder()
                .locationLevel(locationLevel)
                .deviceBreakdown(deviceBreakdown)
                .utmParamGrouping(utmGrouping)
                .build();
        return Mono.defer(() -> statsDataService.getTopListData(
                item, metric, interval(start, end), granularity, limit, options));
    }

    @GetMapping("/top/{item}/realtime")
    @Operation(summary = "Get realtime top list", description = "Live top 10 for today, never cached")
    public Mono<TopListResponse> getRealtimeTopList(@PathVariable TopListItemType item) {
        return statsDataService.getRealtimeTopListData(item);
    }

    @GetMapping("/top/{item}/metrics")
    @Operation(summary = "Get supported metrics", description = "Metrics a top list of this category can be ranked by")
    public Mono<List<SiteMetric>> getSupportedMetrics(@PathVariable TopListItemType item) {
        return Mono.just(statsDataService.getSupportedMetrics(item));
    }

    @GetMapping("/chart")
    @Operation(summary = "Get chart data", description = "Metric series with the preceding period mapped onto the same axis")
    public Mono<ChartData> getChartData(
            @RequestParam SiteMetric metric,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "DAY") Granularity granularity) {
        return Mono.defer(() -> chartDataService.getChartData(metric, interval(start, end), granularity));
    }

    @GetMapping("/chart/selection")
    @Operation(summary = "Select chart points", description = "Current and previous points under a probe date")
    public Mono<SelectedDataPoints> getSelection(
            @RequestParam SiteMetric metric,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "DAY") Granularity granularity,
            @RequestParam Instant probe) {
        return Mono.defer(() -> chartDataService.getSelection(metric, interval(start, end), granularity, probe));
    }

    @GetMapping("/posts/{postId}")
    @Operation(summary = "Get post details", description = "Lifetime views, records and daily views of a post")
    public Mono<PostDetailsResponse> getPostDetails(@PathVariable @Min(1) long postId) {
        return statsDataService.getPostDetails(postId);
    }

    @GetMapping("/posts/{postId}/likes")
    @Operation(summary = "Get post likes", description = "Most recent likers of a post and the total like count")
    public Mono<PostLikesResponse> getPostLikes(
            @PathVariable @Min(1) long postId,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int count) {
        return statsDataService.getPostLikes(postId, count);
    }

    @GetMapping("/posts/{postId}/email-opens")
    @Operation(summary = "Get email opens", description = "Newsletter sends and opens of a post")
    public Mono<EmailOpensResponse> getEmailOpens(@PathVariable @Min(1) long postId) {
        return statsDataService.getEmailOpens(postId);
    }

    @PostMapping("/referrers/spam")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Toggle referrer spam", description = "Marks a referrer domain as spam, or unmarks it when currentValue is true")
    public Mono<Void> toggleSpamState(
            @RequestParam @NotBlank String domain,
            @RequestParam boolean currentValue) {
        return statsDataService.toggleSpamState(domain, currentValue);
    }

    private DateInterval interval(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        ZoneId zone = statsDataService.getSiteZone();
        return new DateInterval(start.atStartOfDay(zone).toInstant(), end.plusDays(1).atStartOfDay(zone).toInstant());
    }
}
