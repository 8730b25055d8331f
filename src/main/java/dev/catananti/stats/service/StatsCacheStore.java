package dev.catananti.stats.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.catananti.stats.dto.CacheStatsResponse;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory cache of one family of stats responses.
 * <p>
 * Entries carry their own TTL, checked lazily on read against the injected {@link Clock}; expired
 * entries stay in the map until overwritten or evicted by size. The lookup and the registration of a
 * fetch happen under one lock, so concurrent misses on the same key share a single in-flight fetch.
 * A fetch writes its result even if every subscriber has cancelled, and failures are never cached.
 *
 * @param <K> cache key, compared by value
 * @param <V> cached response type
 */
@Slf4j
public class StatsCacheStore<K, V> {

    private final String family;
    private final Clock clock;
    private final Cache<K, CachedEntity<V>> entries;
    private final Map<K, Mono<V>> inFlight = new HashMap<>();
    private final Object lock = new Object();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();

    public StatsCacheStore(String family, Clock clock, long maximumSize) {
        this.family = family;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    public String getFamily() {
        return family;
    }

    /**
     * Returns the entry for {@code key} unless it is missing or expired.
     */
    public Optional<CachedEntity<V>> get(K key) {
        synchronized (lock) {
            return lookup(key);
        }
    }

    public void put(K key, V data, Duration ttl) {
        synchronized (lock) {
            entries.put(key, new CachedEntity<>(data, clock.instant(), ttl));
        }
    }

    /**
     * Returns the cached value for {@code key}, or subscribes to {@code loader} and caches its result
     * with the TTL computed by {@code ttlPolicy} at the time the value arrives.
     * Identical concurrent misses join the fetch that is already running.
     */
    public Mono<V> getOrLoad(K key, Supplier<Mono<V>> loader, Function<? super V, Duration> ttlPolicy) {
        return Mono.defer(() -> {
            synchronized (lock) {
                Optional<CachedEntity<V>> cached = lookup(key);
                if (cached.isPresent()) {
                    hits.incrementAndGet();
                    log.debug("Cache hit [{}]: {}", family, key);
                    return Mono.just(cached.get().data());
                }
                Mono<V> pending = inFlight.get(key);
                if (pending != null) {
                    coalesced.incrementAndGet();
                    log.debug("Joining in-flight fetch [{}]: {}", family, key);
                    return pending;
                }
                misses.incrementAndGet();
                log.debug("Cache miss [{}]: {}", family, key);
                Mono<V> fetch = Mono.defer(loader)
                        .doOnNext(value -> put(key, value, ttlPolicy.apply(value)))
                        .doFinally(signal -> release(key))
                        .cache();
                inFlight.put(key, fetch);
                return fetch;
            }
        });
    }

    public void invalidateAll() {
        synchronized (lock) {
            entries.invalidateAll();
        }
        log.info("Cache [{}] invalidated", family);
    }

    public CacheStatsResponse stats() {
        return new CacheStatsResponse(family, entries.estimatedSize(), hits.get(), misses.get(), coalesced.get());
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }

    public long coalescedCount() {
        return coalesced.get();
    }

    private Optional<CachedEntity<V>> lookup(K key) {
        CachedEntity<V> entity = entries.getIfPresent(key);
        if (entity == null || entity.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entity);
    }

    private void release(K key) {
        synchronized (lock) {
            inFlight.remove(key);
        }
    }
}
