package dev.catananti.stats.service.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.stats.config.ResilienceConfig;
import dev.catananti.stats.config.StatsConfig;
import dev.catananti.stats.dto.EmailOpensResponse;
import dev.catananti.stats.dto.PostLikesResponse;
import dev.catananti.stats.dto.TopListOptions;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;
import dev.catananti.stats.entity.UtmParamGrouping;
import dev.catananti.stats.exception.StatsRemoteException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link StatsRemoteGateway} backed by the WordPress.com REST API (v1.1).
 * <p>
 * Every call is bounded by the external timeout from {@link ResilienceConfig} and guarded by a
 * circuit breaker. No call is retried. Errors are translated to {@link StatsRemoteException}:
 * 401/403 become {@code AUTHORIZATION} (carrying the API's error code and message), a top-list
 * payload without {@code summary} becomes {@code EMPTY_SUMMARY}, anything else {@code TRANSPORT}.
 */
@Component
@Slf4j
public class WpComStatsGateway implements StatsRemoteGateway {

    private static final String SERIES_FIELDS = "views,visitors,likes,comments,posts";
    private static final DateTimeFormatter HOUR_PERIOD = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern WEEK_PERIOD = Pattern.compile("^(\\d{4})W(\\d{2})W(\\d{2})$");
    private static final Pattern MONTH_PERIOD = Pattern.compile("^(\\d{4})-(\\d{2})$");
    private static final Pattern YEAR_PERIOD = Pattern.compile("^(\\d{4})$");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ResilienceConfig resilience;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final long siteId;
    private final ZoneId localZone;

    public WpComStatsGateway(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            StatsConfig statsConfig,
            ResilienceConfig resilience,
            Clock clock,
            @Value("${stats.remote.base-url:https://public-api.wordpress.com/rest/v1.1}") String baseUrl,
            @Value("${stats.remote.api-token:}") String apiToken) {
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken)
                .build();
        this.objectMapper = objectMapper;
        this.resilience = resilience;
        this.circuitBreaker = resilience.statsCircuitBreaker();
        this.clock = clock;
        this.siteId = statsConfig.getSiteId();
        this.localZone = statsConfig.getLocalTimeZone();
        log.info("Stats gateway initialised for site {} at {}", siteId, baseUrl);
    }

    // ──────────────────────────────────────────────
    // Series
    // ──────────────────────────────────────────────

    @Override
    public Mono<RawTimeSeries> fetchSeries(DateInterval interval, Granularity granularity, int limit) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("unit", unit(granularity));
        query.add("start_date", formatDate(interval.start()));
        query.add("date", formatDate(interval.end()));
        query.add("stat_fields", SERIES_FIELDS);
        if (limit > 0) {
            query.add("quantity", String.valueOf(limit));
        }
        return get("stats/visits", query).map(this::parseSeries);
    }

    @Override
    public Mono<RawWordAdsSeries> fetchWordAdsSeries(Instant date, Granularity granularity, int quantity) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("unit", unit(granularity));
        query.add("date", formatDate(date));
        query.add("quantity", String.valueOf(quantity));
        return get("wordads/stats", query).map(this::parseWordAds);
    }

    // ──────────────────────────────────────────────
    // Top lists
    // ──────────────────────────────────────────────

    @Override
    public Mono<RawItemList> fetchTopList(TopListItemType item, DateInterval interval, Granularity granularity,
                                          int limit, TopListOptions options) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("period", unit(granularity));
        query.add("start_date", formatDate(interval.start()));
        query.add("date", formatDate(interval.end()));
        query.add("summarize", "1");
        if (limit > 0) {
            query.add("max", String.valueOf(limit));
        }
        String endpoint = topListEndpoint(item, options);
        return get("stats/" + endpoint, query).map(body -> parseTopList(item, endpoint, body));
    }

    @Override
    public Mono<RawItemList> fetchRealtimeTopList(TopListItemType item, int limit) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("period", "day");
        query.add("date", formatDate(clock.instant()));
        query.add("summarize", "1");
        query.add("max", String.valueOf(limit));
        String endpoint = topListEndpoint(item, TopListOptions.defaults());
        return get("stats/" + endpoint, query).map(body -> parseTopList(item, endpoint, body));
    }

    @Override
    public Mono<RawDeviceItems> fetchDeviceBreakdown(DeviceBreakdown breakdown, DateInterval interval) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("start_date", formatDate(interval.start()));
        query.add("end_date", formatDate(interval.end()));
        return get("stats/devices/" + breakdown.value(), query).map(this::parseDevices);
    }

    @Override
    public Mono<RawUtmItems> fetchUtm(UtmParamGrouping grouping, DateInterval interval, int maxResults) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("start_date", formatDate(interval.start()));
        query.add("end_date", formatDate(interval.end()));
        query.add("max", String.valueOf(maxResults));
        return get("stats/utm/" + grouping.parameters(), query).map(this::parseUtm);
    }

    // ──────────────────────────────────────────────
    // Posts and referrers
    // ──────────────────────────────────────────────

    @Override
    public Mono<RawPostDetails> fetchPostDetails(long postId) {
        return get("stats/post/" + postId, new LinkedMultiValueMap<>()).map(this::parsePostDetails);
    }

    @Override
    public Mono<PostLikesResponse> fetchPostLikes(long postId, int count) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("number", String.valueOf(count));
        return get("posts/" + postId + "/likes", query).map(this::parseLikes);
    }

    @Override
    public Mono<EmailOpensResponse> fetchEmailOpens(long postId) {
        return get("stats/opens/emails/" + postId + "/rate", new LinkedMultiValueMap<>())
                .map(body -> new EmailOpensResponse(
                        integer(body, "total_sends"),
                        integer(body, "unique_opens"),
                        integer(body, "total_opens"),
                        decimal(body, "opens_rate")));
    }

    @Override
    public Mono<Void> toggleSpamState(String referrerDomain, boolean currentValue) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("domain", referrerDomain);
        String action = currentValue ? "delete" : "new";
        return call(HttpMethod.POST, "stats/referrers/spam/" + action, query).then();
    }

    // ──────────────────────────────────────────────
    // Transport
    // ──────────────────────────────────────────────

    private Mono<JsonNode> get(String path, MultiValueMap<String, String> query) {
        return call(HttpMethod.GET, path, query);
    }

    private Mono<JsonNode> call(HttpMethod method, String path, MultiValueMap<String, String> query) {
        return webClient.method(method)
                .uri(builder -> builder.path("/sites/" + siteId + "/" + path).queryParams(query).build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(resilience.getExternalTimeout())
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorMap(e -> !(e instanceof StatsRemoteException), e -> translate(path, e));
    }

    private StatsRemoteException translate(String path, Throwable e) {
        if (e instanceof WebClientResponseException response) {
            HttpStatus status = HttpStatus.resolve(response.getStatusCode().value());
            if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
                JsonNode body = readBody(response.getResponseBodyAsString());
                String code = body.path("error").asText(null);
                String message = body.path("message").asText(response.getStatusText());
                log.warn("Stats API refused {}: {} {}", path, code, message);
                return new StatsRemoteException(StatsRemoteException.Kind.AUTHORIZATION,
                        response.getStatusCode().value(), code, message);
            }
            log.error("Stats API {} failed with HTTP {}", path, response.getStatusCode().value());
            return new StatsRemoteException(StatsRemoteException.Kind.TRANSPORT,
                    response.getStatusCode().value(), null, "Stats API returned HTTP " + response.getStatusCode().value());
        }
        if (e instanceof TimeoutException) {
            log.error("Stats API {} timed out after {}", path, resilience.getExternalTimeout());
            return new StatsRemoteException(StatsRemoteException.Kind.TRANSPORT, "Stats API request timed out", e);
        }
        if (e instanceof CallNotPermittedException) {
            log.warn("Stats API circuit breaker is open, rejecting {}", path);
            return new StatsRemoteException(StatsRemoteException.Kind.TRANSPORT, "Stats API temporarily unavailable", e);
        }
        log.error("Stats API {} failed: {}", path, e.getMessage());
        return new StatsRemoteException(StatsRemoteException.Kind.TRANSPORT, "Stats API request failed", e);
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    // ──────────────────────────────────────────────
    // Parsing
    // ──────────────────────────────────────────────

    RawTimeSeries parseSeries(JsonNode body) {
        List<String> fields = fieldNames(body);
        int periodIndex = fields.indexOf("period");
        List<RawTimeSeries.Period> periods = new ArrayList<>();
        for (JsonNode row : body.path("data")) {
            Instant date = parsePeriod(row.path(periodIndex).asText());
            if (date == null) {
                continue;
            }
            Map<String, Integer> values = new HashMap<>();
            for (SiteMetric metric : SiteMetric.values()) {
                int index = metric.isSeriesMetric() ? fields.indexOf(metric.getWireKey()) : -1;
                if (index >= 0 && !row.path(index).isNull() && !row.path(index).isMissingNode()) {
                    values.put(metric.getWireKey(), row.path(index).asInt());
                }
            }
            periods.add(new RawTimeSeries.Period(date, values));
        }
        return new RawTimeSeries(periods);
    }

    RawWordAdsSeries parseWordAds(JsonNode body) {
        List<String> fields = fieldNames(body);
        int periodIndex = fields.indexOf("period");
        int impressionsIndex = fields.indexOf("impressions");
        int cpmIndex = fields.indexOf("cpm");
        int revenueIndex = fields.indexOf("revenue");
        List<RawWordAdsSeries.Period> periods = new ArrayList<>();
        for (JsonNode row : body.path("data")) {
            Instant date = parsePeriod(row.path(periodIndex).asText());
            if (date == null) {
                continue;
            }
            periods.add(new RawWordAdsSeries.Period(date,
                    row.path(impressionsIndex).asLong(),
                    row.path(cpmIndex).asDouble(),
                    row.path(revenueIndex).asDouble()));
        }
        return new RawWordAdsSeries(periods);
    }

    RawItemList parseTopList(TopListItemType item, String endpoint, JsonNode body) {
        JsonNode summary = body.path("summary");
        if (summary.isMissingNode() || summary.isNull()) {
            throw StatsRemoteException.emptySummary(endpoint);
        }
        List<RawItem> items = new ArrayList<>();
        switch (item) {
            case POSTS_AND_PAGES -> summary.path("postviews").forEach(node -> items.add(post(node)));
            case AUTHORS -> summary.path("authors").forEach(node -> items.add(new RawItem(
                    text(node, "id"), text(node, "name"), text(node, "avatar"), null, null, null, null,
                    integer(node, "views"), null, children(node.path("posts"), this::post))));
            case REFERRERS -> summary.path("groups").forEach(node -> items.add(new RawItem(
                    null, text(node, "name"), text(node, "url"), null, null, null, null,
                    integer(node, "total"), null, children(node.path("results"), this::link))));
            case EXTERNAL_LINKS -> summary.path("clicks").forEach(node -> items.add(link(node)));
            case LOCATIONS -> summary.path("views").forEach(node -> items.add(location(node, body.path("country-info"))));
            case FILE_DOWNLOADS -> summary.path("files").forEach(node -> items.add(new RawItem(
                    null, text(node, "filename"), text(node, "relative_url"), null, null, null, null,
                    null, integer(node, "downloads"), null)));
            case SEARCH_TERMS -> summary.path("search_terms").forEach(node -> items.add(new RawItem(
                    null, text(node, "term"), null, null, null, null, null,
                    integer(node, "views"), null, null)));
            case VIDEOS -> summary.path("plays").forEach(node -> items.add(new RawItem(
                    text(node, "post_id"), text(node, "title"), text(node, "url"), null, null, null, null,
                    integer(node, "plays"), null, null)));
            case ARCHIVE -> summary.fields().forEachRemaining(section -> section.getValue().forEach(node ->
                    items.add(new RawItem(null, text(node, "value"), text(node, "href"), null,
                            section.getKey(), null, null, integer(node, "views"), null, null))));
            default -> throw new IllegalArgumentException("Top list category " + item + " has a dedicated endpoint");
        }
        return new RawItemList(items);
    }

    RawDeviceItems parseDevices(JsonNode body) {
        List<RawDeviceItems.Item> items = new ArrayList<>();
        body.path("top_values").fields().forEachRemaining(entry ->
                items.add(new RawDeviceItems.Item(entry.getKey(), entry.getValue().asDouble())));
        return new RawDeviceItems(items);
    }

    RawUtmItems parseUtm(JsonNode body) {
        JsonNode topPosts = body.path("top_posts");
        List<RawUtmItems.Item> items = new ArrayList<>();
        body.path("top_utm_values").fields().forEachRemaining(entry -> items.add(new RawUtmItems.Item(
                utmValues(entry.getKey()),
                entry.getValue().asInt(),
                children(topPosts.path(entry.getKey()), this::post))));
        return new RawUtmItems(items);
    }

    RawPostDetails parsePostDetails(JsonNode body) {
        List<RawPostDetails.Period> views = new ArrayList<>();
        for (JsonNode row : body.path("data")) {
            Instant date = parsePeriod(row.path(0).asText());
            if (date != null) {
                views.add(new RawPostDetails.Period(date, row.path(1).asInt()));
            }
        }
        Map<Integer, Integer> yearlyTotals = new TreeMap<>();
        body.path("years").fields().forEachRemaining(year -> {
            try {
                yearlyTotals.put(Integer.parseInt(year.getKey()), year.getValue().path("total").asInt());
            } catch (NumberFormatException e) {
                log.warn("Ignoring post stats year '{}'", year.getKey());
            }
        });
        JsonNode post = body.path("post");
        return new RawPostDetails(
                firstText(post, "post_title", "title"),
                firstText(post, "URL", "guid"),
                integer(body, "views"),
                integer(body, "highest_month"),
                integer(body, "highest_day_average"),
                integer(body, "highest_week_average"),
                yearlyTotals,
                views);
    }

    PostLikesResponse parseLikes(JsonNode body) {
        List<PostLikesResponse.Liker> users = new ArrayList<>();
        for (JsonNode like : body.path("likes")) {
            String name = firstText(like, "name", "login");
            users.add(new PostLikesResponse.Liker(
                    like.path("ID").asLong(),
                    name != null ? name : "",
                    text(like, "avatar_URL")));
        }
        return new PostLikesResponse(users, body.path("found").asInt(users.size()));
    }

    private RawItem post(JsonNode node) {
        return new RawItem(text(node, "id"), text(node, "title"), firstText(node, "href", "url"),
                null, null, text(node, "type"), text(node, "date"), integer(node, "views"), null, null);
    }

    private RawItem link(JsonNode node) {
        return new RawItem(null, text(node, "name"), text(node, "url"), null, null, null, null,
                integer(node, "views"), null, children(node.path("children"), this::link));
    }

    private RawItem location(JsonNode node, JsonNode countryInfo) {
        String countryCode = text(node, "country_code");
        String name = text(node, "location");
        if (name == null && countryCode != null) {
            name = countryInfo.path(countryCode).path("country_full").asText(countryCode);
        }
        return new RawItem(null, name, null, countryCode, null, null, null, integer(node, "views"), null, null);
    }

    private List<String> utmValues(String key) {
        try {
            JsonNode parsed = objectMapper.readTree(key);
            if (parsed.isArray()) {
                List<String> values = new ArrayList<>();
                parsed.forEach(value -> values.add(value.asText()));
                return values;
            }
        } catch (JsonProcessingException e) {
            log.debug("UTM key is a plain value: {}", key);
        }
        return List.of(key);
    }

    private String topListEndpoint(TopListItemType item, TopListOptions options) {
        if (item != TopListItemType.LOCATIONS) {
            return item.endpoint();
        }
        return switch (options.locationLevelOrDefault()) {
            case COUNTRIES -> item.endpoint();
            case REGIONS -> "location-views/region";
            case CITIES -> "location-views/city";
        };
    }

    private static List<String> fieldNames(JsonNode body) {
        List<String> fields = new ArrayList<>();
        body.path("fields").forEach(field -> fields.add(field.asText()));
        return fields;
    }

    private static List<RawItem> children(JsonNode array, Function<JsonNode, RawItem> mapper) {
        List<RawItem> result = new ArrayList<>();
        Iterator<JsonNode> iterator = array.elements();
        while (iterator.hasNext()) {
            result.add(mapper.apply(iterator.next()));
        }
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asInt();
    }

    private static Double decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asDouble();
    }

    /**
     * Parses a period label ({@code 2025-01-05}, {@code 2025-01-05 13:00:00}, {@code 2025W01W06},
     * {@code 2025-01} or {@code 2025}) as a local-zone instant; unknown formats yield {@code null}.
     */
    Instant parsePeriod(String period) {
        if (period == null || period.isBlank()) {
            return null;
        }
        try {
            if (period.length() == 19) {
                return LocalDateTime.parse(period, HOUR_PERIOD).atZone(localZone).toInstant();
            }
            if (period.length() == 10 && period.charAt(4) == '-') {
                return LocalDate.parse(period).atStartOfDay(localZone).toInstant();
            }
            Matcher week = WEEK_PERIOD.matcher(period);
            if (week.matches()) {
                return localDate(week.group(1), week.group(2), week.group(3));
            }
            Matcher month = MONTH_PERIOD.matcher(period);
            if (month.matches()) {
                return localDate(month.group(1), month.group(2), "1");
            }
            Matcher year = YEAR_PERIOD.matcher(period);
            if (year.matches()) {
                return localDate(year.group(1), "1", "1");
            }
        } catch (DateTimeException e) {
            log.warn("Invalid period '{}': {}", period, e.getMessage());
            return null;
        }
        log.warn("Unrecognised period format '{}'", period);
        return null;
    }

    private Instant localDate(String year, String month, String day) {
        return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day))
                .atStartOfDay(localZone)
                .toInstant();
    }

    private String formatDate(Instant instant) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(instant.atZone(localZone));
    }

    private static String unit(Granularity granularity) {
        return granularity.name().toLowerCase(Locale.ROOT);
    }
}
