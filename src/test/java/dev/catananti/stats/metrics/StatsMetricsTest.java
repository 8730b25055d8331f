package dev.catananti.stats.metrics;

import dev.catananti.stats.exception.StatsRemoteException;
import dev.catananti.stats.service.StatsCacheStore;
import dev.catananti.stats.support.MutableClock;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StatsMetrics")
class StatsMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private StatsMetrics statsMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        statsMetrics = new StatsMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("registerCache()")
    class RegisterCache {

        @Test
        @DisplayName("should expose hit, miss and coalesced counters tagged by family")
        void shouldTrackCacheCounters() {
            StatsCacheStore<String, String> store =
                    new StatsCacheStore<>("top-lists", new MutableClock(Instant.parse("2025-01-05T12:00:00Z")), 10);
            statsMetrics.registerCache(store);

            store.getOrLoad("k", () -> Mono.just("v"), v -> null).block();
            store.getOrLoad("k", () -> Mono.just("v"), v -> null).block();

            FunctionCounter hits = meterRegistry.find("stats.cache.hits").tag("family", "top-lists").functionCounter();
            FunctionCounter misses = meterRegistry.find("stats.cache.misses").tag("family", "top-lists").functionCounter();
            assertThat(hits).isNotNull();
            assertThat(misses).isNotNull();
            assertThat(hits.count()).isEqualTo(1.0);
            assertThat(misses.count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("timeFetch()")
    class TimeFetch {

        @Test
        @DisplayName("should time successful fetches")
        void shouldTimeSuccess() {
            StepVerifier.create(statsMetrics.timeFetch("site-stats", Mono.just(1)))
                    .expectNext(1)
                    .verifyComplete();

            Timer timer = meterRegistry.find("stats.remote.fetch")
                    .tags("family", "site-stats", "outcome", "success").timer();
            assertThat(timer).isNotNull();
            assertThat(timer.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should count failures by exception type")
        void shouldCountFailures() {
            Mono<Integer> failing = Mono.error(
                    new StatsRemoteException(StatsRemoteException.Kind.TRANSPORT, "down", null));

            StepVerifier.create(statsMetrics.timeFetch("wordads-stats", failing))
                    .expectError(StatsRemoteException.class)
                    .verify();

            assertThat(meterRegistry.find("stats.remote.failures")
                    .tags("family", "wordads-stats", "exception", "StatsRemoteException")
                    .counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.find("stats.remote.fetch").tag("outcome", "error").timer()).isNotNull();
        }
    }
}
