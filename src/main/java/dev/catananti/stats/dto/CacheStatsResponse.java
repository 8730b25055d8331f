package dev.catananti.stats.dto;

/**
 * Snapshot of one cache family's counters.
 */
public record CacheStatsResponse(String family, long entries, long hits, long misses, long coalesced) {
}
