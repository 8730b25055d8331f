package dev.catananti.stats.controller;

import dev.catananti.stats.dto.EmailOpensResponse;
import dev.catananti.stats.dto.MetricSet;
import dev.catananti.stats.dto.PostLikesResponse;
import dev.catananti.stats.dto.SelectedDataPoints;
import dev.catananti.stats.dto.SiteMetricsResponse;
import dev.catananti.stats.dto.TopListOptions;
import dev.catananti.stats.dto.TopListResponse;
import dev.catananti.stats.dto.WordAdsMetricsResponse;
import dev.catananti.stats.entity.DataPoint;
import dev.catananti.stats.entity.DateInterval;
import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.Granularity;
import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;
import dev.catananti.stats.entity.WordAdsMetric;
import dev.catananti.stats.service.ChartDataService;
import dev.catananti.stats.service.StatsDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatsControllerTest {

    private static final ZoneId SITE = ZoneId.of("America/New_York");

    @Mock
    private StatsDataService statsDataService;

    @Mock
    private ChartDataService chartDataService;

    private StatsController controller;

    @BeforeEach
    void setUp() {
        lenient().when(statsDataService.getSiteZone()).thenReturn(SITE);
        Clock clock = Clock.fixed(Instant.parse("2025-01-06T03:30:00Z"), ZoneOffset.UTC);
        controller = new StatsController(statsDataService, chartDataService, clock);
    }

    private static DateInterval siteDays(LocalDate start, LocalDate endExclusive) {
        return new DateInterval(start.atStartOfDay(SITE).toInstant(), endExclusive.atStartOfDay(SITE).toInstant());
    }

    @Nested
    @DisplayName("GET /api/v1/stats/site")
    class GetSiteStats {

        @Test
        @DisplayName("Should treat the end date as inclusive in the site zone")
        void shouldBuildInclusiveInterval() {
            SiteMetricsResponse response = new SiteMetricsResponse(MetricSet.of(SiteMetric.VIEWS, 5),
                    Map.of(SiteMetric.VIEWS, List.of(new DataPoint(Instant.parse("2025-01-01T05:00:00Z"), 5))));
            DateInterval expected = siteDays(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 8));
            when(statsDataService.getSiteStats(expected, Granularity.DAY)).thenReturn(Mono.just(response));

            StepVerifier.create(controller.getSiteStats(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 7), Granularity.DAY))
                    .assertNext(body -> assertThat(body.total().get(SiteMetric.VIEWS)).contains(5))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should reject an end date before the start date")
        void shouldRejectReversedRange() {
            StepVerifier.create(controller.getSiteStats(LocalDate.of(2025, 1, 7), LocalDate.of(2025, 1, 1), Granularity.DAY))
                    .expectError(IllegalArgumentException.class)
                    .verify();

            verify(statsDataService, never()).getSiteStats(any(), any());
        }
    }

    @Nested
    @DisplayName("GET /api/v1/stats/wordads")
    class GetWordAdsStats {

        private final WordAdsMetricsResponse empty =
                new WordAdsMetricsResponse(MetricSet.empty(WordAdsMetric.class), Map.of());

        @Test
        @DisplayName("Should default to the start of today in the site zone, read from the injected clock")
        void shouldDefaultToSiteToday() {
            // 03:30 UTC on Jan 6 is still Jan 5 in New York
            Instant siteToday = LocalDate.of(2025, 1, 5).atStartOfDay(SITE).toInstant();
            when(statsDataService.getWordAdsStats(siteToday, Granularity.DAY)).thenReturn(Mono.just(empty));

            StepVerifier.create(controller.getWordAdsStats(null, Granularity.DAY))
                    .expectNext(empty)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should pass an explicit date through unchanged")
        void shouldUseGivenDate() {
            Instant date = Instant.parse("2024-12-01T05:00:00Z");
            when(statsDataService.getWordAdsStats(date, Granularity.MONTH)).thenReturn(Mono.just(empty));

            StepVerifier.create(controller.getWordAdsStats(date, Granularity.MONTH))
                    .expectNext(empty)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Posts and referrers")
    class PostsAndReferrers {

        @Test
        @DisplayName("Should delegate post likes with the requested count")
        void shouldDelegateLikes() {
            PostLikesResponse likes = new PostLikesResponse(List.of(), 0);
            when(statsDataService.getPostLikes(12L, 5)).thenReturn(Mono.just(likes));

            StepVerifier.create(controller.getPostLikes(12L, 5))
                    .expectNext(likes)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should delegate email opens")
        void shouldDelegateEmailOpens() {
            EmailOpensResponse opens = new EmailOpensResponse(10, 4, 6, 0.4);
            when(statsDataService.getEmailOpens(12L)).thenReturn(Mono.just(opens));

            StepVerifier.create(controller.getEmailOpens(12L))
                    .expectNext(opens)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should forward the spam toggle")
        void shouldToggleSpam() {
            when(statsDataService.toggleSpamState("spam.example", true)).thenReturn(Mono.empty());

            StepVerifier.create(controller.toggleSpamState("spam.example", true))
                    .verifyComplete();

            verify(statsDataService).toggleSpamState("spam.example", true);
        }
    }

    @Nested
    @DisplayName("GET /api/v1/stats/top/{item}")
    class GetTopList {

        @Test
        @DisplayName("Should pass the category options to the service")
        void shouldPassOptions() {
            when(statsDataService.getTopListData(eq(TopListItemType.DEVICES), eq(SiteMetric.VIEWS), any(),
                    eq(Granularity.DAY), eq(5), any())).thenReturn(Mono.just(TopListResponse.empty()));
            ArgumentCaptor<TopListOptions> options = ArgumentCaptor.forClass(TopListOptions.class);

            StepVerifier.create(controller.getTopList(TopListItemType.DEVICES,
                            LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 1),
                            SiteMetric.VIEWS, Granularity.DAY, 5, null, DeviceBreakdown.BROWSER, null))
                    .assertNext(body -> assertThat(body.items()).isEmpty())
                    .verifyComplete();

            verify(statsDataService).getTopListData(eq(TopListItemType.DEVICES), eq(SiteMetric.VIEWS), any(),
                    eq(Granularity.DAY), eq(5), options.capture());
            assertThat(options.getValue().deviceBreakdown()).isEqualTo(DeviceBreakdown.BROWSER);
            assertThat(options.getValue().locationLevel()).isNull();
        }

        @Test
        @DisplayName("Should list the supported metrics of a category")
        void shouldReturnSupportedMetrics() {
            when(statsDataService.getSupportedMetrics(TopListItemType.FILE_DOWNLOADS))
                    .thenReturn(List.of(SiteMetric.DOWNLOADS));

            StepVerifier.create(controller.getSupportedMetrics(TopListItemType.FILE_DOWNLOADS))
                    .expectNext(List.of(SiteMetric.DOWNLOADS))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should delegate realtime requests")
        void shouldDelegateRealtime() {
            when(statsDataService.getRealtimeTopListData(TopListItemType.REFERRERS))
                    .thenReturn(Mono.just(TopListResponse.empty()));

            StepVerifier.create(controller.getRealtimeTopList(TopListItemType.REFERRERS))
                    .expectNextCount(1)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("GET /api/v1/stats/chart/selection")
    class GetSelection {

        @Test
        @DisplayName("Should forward the probe date")
        void shouldForwardProbe() {
            Instant probe = Instant.parse("2025-01-03T12:00:00Z");
            DataPoint point = new DataPoint(Instant.parse("2025-01-03T05:00:00Z"), 4);
            DateInterval expected = siteDays(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 8));
            when(chartDataService.getSelection(SiteMetric.VIEWS, expected, Granularity.DAY, probe))
                    .thenReturn(Mono.just(new SelectedDataPoints(point, null, null)));

            StepVerifier.create(controller.getSelection(SiteMetric.VIEWS,
                            LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 7), Granularity.DAY, probe))
                    .assertNext(selection -> assertThat(selection.current()).isEqualTo(point))
                    .verifyComplete();
        }
    }
}
