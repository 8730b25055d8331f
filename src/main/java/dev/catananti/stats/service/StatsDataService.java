package dev.catananti.stats.service;

import dev.catananti.stats.config.StatsConfig;
import dev.catananti.stats.dto.CacheStatsResponse;
import dev.catananti.stats.dto.EmailOpensResponse;
import dev.catananti.stats.dto.MetricSet;
import dev.catananti.stats.dto.PostDetailsResponse;
import dev.catananti.stats.dto.PostLikesResponse;
import dev.catananti.stats.dto.SiteMetricsResponse;
import dev.catananti.stats.dto.TopListItem;
import dev.catananti.stats.dto.TopListOptions;
import dev.catananti.stats.dto.TopListResponse;
import dev.catananti.stats.dto.WordAdsMetricsResponse;
import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.LocationLevel;
import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;
import dev.catananti.stats.entity.WordAdsMetric;
import dev.catananti.stats.exception.FeatureGatedException;
import dev.catananti.stats.exception.StatsRemoteException;
import dev.catananti.stats.exception.UnsupportedCombinationException;
import dev.catananti.stats.metrics.StatsMetrics;
import dev.catananti.stats.service.remote.RawPostDetails;
import dev.catananti.stats.service.remote.RawTimeSeries;
import dev.catananti.stats.service.remote.RawWordAdsSeries;
import dev.catananti.stats.service.remote.StatsRemoteGateway;
import dev.catananti.stats.util.DataPoints;
import dev.catananti.stats.util.SiteTimeZones;
import dev.catananti.stats.util.TopListRanker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cached access to site stats, WordAds earnings and top lists.
 * <p>
 * Each request is keyed by its exact parameters. On a miss the interval is converted to the local
 * zone the remote API expects, the gateway is called, dates are converted back to the site zone and
 * points dated in the future are dropped. Results covering the current site-local day are cached for
 * a short TTL; historical results never expire.
 */
@Service
@Slf4j
public class StatsDataService {

    static final String SITE_STATS = "site-stats";
    static final String WORDADS_STATS = "wordads-stats";
    static final String TOP_LISTS = "top-lists";
    static final String POSTS = "posts";
    static final String REFERRER_SPAM = "referrer-spam";

    private static final int REALTIME_LIMIT = 10;
    private static final int DEFAULT_UTM_RESULTS = 10;

    private static final Set<String> FEATURE_GATE_CODES = Set.of(
            "upgrade_required", "plan_upgrade_required", "feature_unavailable", "stats_upgrade_required");
    private static final Pattern FEATURE_GATE_MESSAGE = Pattern.compile(
            "(?i)(upgrade|paid plan|not available on your plan|feature is not available)");

    record SiteStatsCacheKey(DateInterval interval, Granularity granularity) {}

    record WordAdsCacheKey(Instant date, Granularity granularity) {}

    record TopListCacheKey(TopListItemType item, SiteMetric metric, DateInterval interval,
                           Granularity granularity, int limit, TopListOptions options) {}

    private final StatsRemoteGateway gateway;
    private final StatsMetrics metrics;
    private final Clock clock;
    private final ZoneId siteZone;
    private final Locale locale;
    private final Duration currentPeriodTtl;
    private final SiteTimeZones timeZones;
    private final TopListItemMapper itemMapper;

    private final StatsCacheStore<SiteStatsCacheKey, SiteMetricsResponse> siteStatsCache;
    private final StatsCacheStore<WordAdsCacheKey, WordAdsMetricsResponse> wordAdsCache;
    private final StatsCacheStore<TopListCacheKey, TopListResponse> topListCache;

    public StatsDataService(StatsRemoteGateway gateway, StatsConfig config, StatsMetrics metrics, Clock clock) {
        this.gateway = gateway;
        this.metrics = metrics;
        this.clock = clock;
        this.siteZone = config.getSiteTimeZone();
        this.locale = config.getLocale();
        this.currentPeriodTtl = config.getCurrentPeriodTtl();
        this.timeZones = new SiteTimeZones(config.getLocalTimeZone());
        this.itemMapper = new TopListItemMapper(siteZone);
        this.siteStatsCache = new StatsCacheStore<>(SITE_STATS, clock, config.getCacheMaximumSize());
        this.wordAdsCache = new StatsCacheStore<>(WORDADS_STATS, clock, config.getCacheMaximumSize());
        this.topListCache = new StatsCacheStore<>(TOP_LISTS, clock, config.getCacheMaximumSize());
        metrics.registerCache(siteStatsCache);
        metrics.registerCache(wordAdsCache);
        metrics.registerCache(topListCache);
    }

    public ZoneId getSiteZone() {
        return siteZone;
    }

    // ──────────────────────────────────────────────
    // Site stats
    // ──────────────────────────────────────────────

    public Mono<SiteMetricsResponse> getSiteStats(DateInterval interval, Granularity granularity) {
        return siteStatsCache.getOrLoad(
                new SiteStatsCacheKey(interval, granularity),
                () -> fetchSiteStats(interval, granularity),
                response -> ttlFor(interval));
    }

    private Mono<SiteMetricsResponse> fetchSiteStats(DateInterval interval, Granularity granularity) {
        DateInterval normalized = timeZones.normalizeInterval(interval, siteZone);
        if (granularity == Granularity.HOUR) {
            // Series from the hourly fetch, totals from the daily one
            return Mono.zip(
                            metrics.timeFetch(SITE_STATS, gateway.fetchSeries(normalized, Granularity.HOUR, 0)),
                            metrics.timeFetch(SITE_STATS, gateway.fetchSeries(normalized, Granularity.DAY, 0)))
                    .map(tuple -> mapSiteMetrics(tuple.getT1()).withTotal(mapSiteMetrics(tuple.getT2()).total()));
        }
        return metrics.timeFetch(SITE_STATS, gateway.fetchSeries(normalized, granularity, 0))
                .map(this::mapSiteMetrics);
    }

    private SiteMetricsResponse mapSiteMetrics(RawTimeSeries raw) {
        Instant now = clock.instant();
        Map<SiteMetric, List<DataPoint>> series = new EnumMap<>(SiteMetric.class);
        Map<SiteMetric, Integer> totals = new EnumMap<>(SiteMetric.class);
        for (SiteMetric metric : SiteMetric.values()) {
            if (!metric.isSeriesMetric()) {
                continue;
            }
            List<DataPoint> points = new ArrayList<>();
            for (RawTimeSeries.Period period : raw.periods()) {
                Integer value = period.values().get(metric.getWireKey());
                if (value == null) {
                    continue;
                }
                Instant date = timeZones.toSiteTimeZone(period.date(), siteZone);
                if (date.isAfter(now)) {
                    continue;
                }
                points.add(new DataPoint(date, value));
            }
            if (!points.isEmpty()) {
                series.put(metric, List.copyOf(points));
                totals.put(metric, DataPoints.totalValue(points, metric.getAggregationStrategy()));
            }
        }
        return new SiteMetricsResponse(MetricSet.of(SiteMetric.class, totals), series);
    }

    // ──────────────────────────────────────────────
    // WordAds
    // ──────────────────────────────────────────────

    public Mono<WordAdsMetricsResponse> getWordAdsStats(Instant date, Granularity granularity) {
        return wordAdsCache.getOrLoad(
                new WordAdsCacheKey(date, granularity),
                () -> fetchWordAdsStats(date, granularity),
                response -> timeZones.isToday(date, siteZone, clock.instant()) ? currentPeriodTtl : null);
    }

    private Mono<WordAdsMetricsResponse> fetchWordAdsStats(Instant date, Granularity granularity) {
        int quantity = granularity.getPreferredQuantity();
        Instant start = granularity.bucketStart(granularity.shift(date, -quantity, siteZone), siteZone);
        DateInterval interval = new DateInterval(start, date);
        return metrics.timeFetch(WORDADS_STATS,
                        gateway.fetchWordAdsSeries(timeZones.toLocal(date, siteZone), granularity, quantity))
                .map(raw -> mapWordAdsMetrics(raw, interval));
    }

    private WordAdsMetricsResponse mapWordAdsMetrics(RawWordAdsSeries raw, DateInterval interval) {
        Instant now = clock.instant();
        List<DataPoint> impressions = new ArrayList<>();
        List<DataPoint> cpm = new ArrayList<>();
        List<DataPoint> revenue = new ArrayList<>();
        for (RawWordAdsSeries.Period period : raw.periods()) {
            Instant date = timeZones.toSiteTimeZone(period.date(), siteZone);
            if (date.isAfter(now) || date.isBefore(interval.start())) {
                continue;
            }
            impressions.add(new DataPoint(date, DataPoints.saturatedInt(period.impressions())));
            cpm.add(new DataPoint(date, toCents(period.cpm())));
            revenue.add(new DataPoint(date, toCents(period.revenue())));
        }

        int totalImpressions = sum(impressions);
        int totalRevenue = sum(revenue);
        int earningPeriods = 0;
        long cpmSum = 0;
        for (DataPoint point : cpm) {
            if (point.value() != 0) {
                earningPeriods++;
                cpmSum += point.value();
            }
        }
        int averageCpm = earningPeriods == 0 ? 0 : DataPoints.saturatedInt(cpmSum / earningPeriods);

        Map<WordAdsMetric, Integer> totals = new EnumMap<>(WordAdsMetric.class);
        totals.put(WordAdsMetric.IMPRESSIONS, totalImpressions);
        totals.put(WordAdsMetric.CPM, averageCpm);
        totals.put(WordAdsMetric.REVENUE, totalRevenue);

        Map<WordAdsMetric, List<DataPoint>> series = new EnumMap<>(WordAdsMetric.class);
        series.put(WordAdsMetric.IMPRESSIONS, List.copyOf(impressions));
        series.put(WordAdsMetric.CPM, List.copyOf(cpm));
        series.put(WordAdsMetric.REVENUE, List.copyOf(revenue));
        return new WordAdsMetricsResponse(MetricSet.of(WordAdsMetric.class, totals), series);
    }

    // ──────────────────────────────────────────────
    // Top lists
    // ──────────────────────────────────────────────

    /**
     * Metrics a top list of the given category can be ranked by.
     */
    public List<SiteMetric> getSupportedMetrics(TopListItemType item) {
        return item == TopListItemType.FILE_DOWNLOADS ? List.of(SiteMetric.DOWNLOADS) : List.of(SiteMetric.VIEWS);
    }

    public Mono<TopListResponse> getTopListData(TopListItemType item, SiteMetric metric, DateInterval interval,
                                                Granularity granularity, int limit, TopListOptions options) {
        if (!getSupportedMetrics(item).contains(metric)) {
            return Mono.error(new UnsupportedCombinationException(item, metric));
        }
        TopListOptions effectiveOptions = options != null ? options : TopListOptions.defaults();
        return topListCache.getOrLoad(
                        new TopListCacheKey(item, metric, interval, granularity, limit, effectiveOptions),
                        () -> fetchTopList(item, metric, interval, limit, effectiveOptions),
                        response -> ttlFor(interval))
                .onErrorResume(this::isEmptySummary, e -> {
                    log.warn("No summary for top list {} in {}, returning an empty list", item, interval);
                    return Mono.just(TopListResponse.empty());
                })
                .onErrorMap(this::isFeatureGated, e -> new FeatureGatedException(item, e.getMessage(), e));
    }

    /**
     * Live top 10 for today, ranked by the category's primary metric. Never cached.
     */
    public Mono<TopListResponse> getRealtimeTopListData(TopListItemType item) {
        if (item == TopListItemType.DEVICES || item == TopListItemType.UTM) {
            return Mono.error(new IllegalArgumentException("Realtime top list is not available for " + item));
        }
        SiteMetric metric = getSupportedMetrics(item).get(0);
        return metrics.timeFetch(TOP_LISTS, gateway.fetchRealtimeTopList(item, REALTIME_LIMIT))
                .map(raw -> rank(itemMapper.map(item, raw.items(), LocationLevel.CITIES), metric, REALTIME_LIMIT))
                .onErrorResume(this::isEmptySummary, e -> {
                    log.warn("No summary for realtime top list {}, returning an empty list", item);
                    return Mono.just(TopListResponse.empty());
                })
                .onErrorMap(this::isFeatureGated, e -> new FeatureGatedException(item, e.getMessage(), e));
    }

    private Mono<TopListResponse> fetchTopList(TopListItemType item, SiteMetric metric, DateInterval interval,
                                               int limit, TopListOptions options) {
        DateInterval normalized = timeZones.normalizeInterval(interval, siteZone);
        Mono<List<TopListItem>> items = switch (item) {
            case DEVICES -> {
                DeviceBreakdown breakdown = options.deviceBreakdownOrDefault();
                yield metrics.timeFetch(TOP_LISTS, gateway.fetchDeviceBreakdown(breakdown, normalized))
                        .map(raw -> itemMapper.devices(raw, breakdown));
            }
            case UTM -> metrics.timeFetch(TOP_LISTS, gateway.fetchUtm(options.utmParamGroupingOrDefault(),
                            normalized, limit > 0 ? limit : DEFAULT_UTM_RESULTS))
                    .map(itemMapper::utm);
            // Summarized top lists are only served for day periods
            default -> metrics.timeFetch(TOP_LISTS,
                            gateway.fetchTopList(item, normalized, Granularity.DAY, limit, options))
                    .map(raw -> itemMapper.map(item, raw.items(), options.locationLevelOrDefault()));
        };
        return items.map(list -> rank(list, metric, limit));
    }

    private TopListResponse rank(List<TopListItem> items, SiteMetric metric, int limit) {
        List<TopListItem> nested = new ArrayList<>(items.size());
        for (TopListItem item : items) {
            if (item instanceof TopListItem.ArchiveSection section) {
                nested.add(new TopListItem.ArchiveSection(section.sectionName(),
                        TopListRanker.rank(section.items(), SiteMetric.VIEWS, locale, 0), section.metrics()));
            } else {
                nested.add(item);
            }
        }
        return new TopListResponse(TopListRanker.rank(nested, metric, locale, limit));
    }

    private boolean isEmptySummary(Throwable e) {
        return e instanceof StatsRemoteException remote && remote.is(StatsRemoteException.Kind.EMPTY_SUMMARY);
    }

    private boolean isFeatureGated(Throwable e) {
        if (!(e instanceof StatsRemoteException remote) || !remote.is(StatsRemoteException.Kind.AUTHORIZATION)) {
            return false;
        }
        if (remote.getErrorCode() != null && FEATURE_GATE_CODES.contains(remote.getErrorCode())) {
            return true;
        }
        return remote.getMessage() != null && FEATURE_GATE_MESSAGE.matcher(remote.getMessage()).find();
    }

    // ──────────────────────────────────────────────
    // Posts and referrers (never cached)
    // ──────────────────────────────────────────────

    public Mono<PostDetailsResponse> getPostDetails(long postId) {
        return metrics.timeFetch(POSTS, gateway.fetchPostDetails(postId))
                .map(raw -> mapPostDetails(postId, raw));
    }

    public Mono<PostLikesResponse> getPostLikes(long postId, int count) {
        return metrics.timeFetch(POSTS, gateway.fetchPostLikes(postId, count));
    }

    public Mono<EmailOpensResponse> getEmailOpens(long postId) {
        return metrics.timeFetch(POSTS, gateway.fetchEmailOpens(postId));
    }

    public Mono<Void> toggleSpamState(String referrerDomain, boolean currentValue) {
        log.info("{} referrer {} as spam", currentValue ? "Unmarking" : "Marking", referrerDomain);
        return metrics.timeFetch(REFERRER_SPAM, gateway.toggleSpamState(referrerDomain, currentValue));
    }

    private PostDetailsResponse mapPostDetails(long postId, RawPostDetails raw) {
        List<DataPoint> dailyViews = new ArrayList<>(raw.views().size());
        for (RawPostDetails.Period period : raw.views()) {
            dailyViews.add(new DataPoint(timeZones.toSiteTimeZone(period.date(), siteZone), period.views()));
        }
        return new PostDetailsResponse(postId,
                raw.postTitle(),
                raw.postUrl(),
                raw.totalViews() != null ? raw.totalViews() : 0,
                raw.highestMonth(),
                raw.highestDayAverage(),
                raw.highestWeekAverage(),
                raw.yearlyTotals(),
                dailyViews);
    }

    // ──────────────────────────────────────────────
    // Cache administration
    // ──────────────────────────────────────────────

    public List<CacheStatsResponse> getCacheStats() {
        return List.of(siteStatsCache.stats(), wordAdsCache.stats(), topListCache.stats());
    }

    public void invalidateCaches() {
        siteStatsCache.invalidateAll();
        wordAdsCache.invalidateAll();
        topListCache.invalidateAll();
    }

    private Duration ttlFor(DateInterval interval) {
        return timeZones.containsCurrentDate(interval, siteZone, clock.instant()) ? currentPeriodTtl : null;
    }

    private static int toCents(double amount) {
        return DataPoints.saturatedInt(Math.round(amount * 100));
    }

    private static int sum(List<DataPoint> points) {
        long total = 0;
        for (DataPoint point : points) {
            total += point.value();
        }
        return DataPoints.saturatedInt(total);
    }
}
