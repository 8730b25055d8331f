package dev.catananti.stats.service;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value with the time it was stored. A {@code null} ttl never expires.
 */
public record CachedEntity<T>(T data, Instant timestamp, Duration ttl) {

    public boolean isExpired(Instant now) {
        if (ttl == null) {
            return false;
        }
        return Duration.between(timestamp, now).compareTo(ttl) > 0;
    }
}
