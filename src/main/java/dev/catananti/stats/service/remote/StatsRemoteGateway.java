package dev.catananti.stats.service.remote;

import dev.catananti.stats.dto.EmailOpensResponse;
import dev.catananti.stats.dto.PostLikesResponse;
import dev.catananti.stats.dto.TopListOptions;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.TopListItemType;
import dev.catananti.stats.entity.UtmParamGrouping;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Asynchronous access to the remote stats API.
 * <p>
 * Intervals passed in are already normalized: both bounds are inclusive and expressed in the
 * local zone. Dates in the returned payloads are local-zone instants as well.
 * Failures are signalled as {@link dev.catananti.stats.exception.StatsRemoteException}.
 */
public interface StatsRemoteGateway {

    /**
     * Site traffic series. {@code limit} caps the number of periods; 0 means no cap.
     */
    Mono<RawTimeSeries> fetchSeries(DateInterval interval, Granularity granularity, int limit);

    /**
     * The {@code quantity} WordAds periods ending on {@code date}.
     */
    Mono<RawWordAdsSeries> fetchWordAdsSeries(Instant date, Granularity granularity, int quantity);

    Mono<RawItemList> fetchTopList(TopListItemType item, DateInterval interval, Granularity granularity,
                                   int limit, TopListOptions options);

    Mono<RawDeviceItems> fetchDeviceBreakdown(DeviceBreakdown breakdown, DateInterval interval);

    Mono<RawUtmItems> fetchUtm(UtmParamGrouping grouping, DateInterval interval, int maxResults);

    /**
     * Top list for the current day, never cached by callers.
     */
    Mono<RawItemList> fetchRealtimeTopList(TopListItemType item, int limit);

    Mono<RawPostDetails> fetchPostDetails(long postId);

    /**
     * Up to {@code count} of the post's likers, plus the total number of likes.
     */
    Mono<PostLikesResponse> fetchPostLikes(long postId, int count);

    Mono<EmailOpensResponse> fetchEmailOpens(long postId);

    /**
     * Marks {@code referrerDomain} as spam, or unmarks it when {@code currentValue} says it already is.
     */
    Mono<Void> toggleSpamState(String referrerDomain, boolean currentValue);
}
