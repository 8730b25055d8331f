package dev.catananti.stats.metrics;

import dev.catananti.stats.service.StatsCacheStore;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Micrometer meters of the stats layer: cache counters per family and remote fetch timings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatsMetrics {

    private final MeterRegistry meterRegistry;

    public void registerCache(StatsCacheStore<?, ?> store) {
        String family = store.getFamily();
        FunctionCounter.builder("stats.cache.hits", store, StatsCacheStore::hitCount)
                .description("Requests served from the stats cache")
                .tag("family", family)
                .register(meterRegistry);
        FunctionCounter.builder("stats.cache.misses", store, StatsCacheStore::missCount)
                .description("Requests that triggered a remote fetch")
                .tag("family", family)
                .register(meterRegistry);
        FunctionCounter.builder("stats.cache.coalesced", store, StatsCacheStore::coalescedCount)
                .description("Requests that joined an in-flight fetch")
                .tag("family", family)
                .register(meterRegistry);
        log.debug("Registered cache metrics for family {}", family);
    }

    /**
     * Times a remote fetch, tagging the timer with the family and the outcome.
     */
    public <T> Mono<T> timeFetch(String family, Mono<T> fetch) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            return fetch
                    .doOnSuccess(value -> sample.stop(fetchTimer(family, "success")))
                    .doOnError(error -> {
                        sample.stop(fetchTimer(family, "error"));
                        meterRegistry.counter("stats.remote.failures", "family", family,
                                "exception", error.getClass().getSimpleName()).increment();
                    });
        });
    }

    private Timer fetchTimer(String family, String outcome) {
        return Timer.builder("stats.remote.fetch")
                .description("Remote stats API fetch duration")
                .tag("family", family)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
