package dev.catananti.stats.controller;

import dev.catananti.stats.dto.CacheStatsResponse;
import dev.catananti.stats.service.StatsDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/stats/cache")
@RequiredArgsConstructor
@Tag(name = "Admin - Stats cache", description = "Stats cache management endpoints")
@Slf4j
public class AdminStatsCacheController {

    private final StatsDataService statsDataService;

    @GetMapping
    @Operation(summary = "Get cache statistics", description = "Entry count and hit/miss counters per cache family")
    public Mono<ResponseEntity<List<CacheStatsResponse>>> getCacheStats() {
        log.debug("Fetching stats cache counters");
        return Mono.fromSupplier(statsDataService::getCacheStats)
                .map(ResponseEntity::ok);
    }

    @DeleteMapping
    @Operation(summary = "Invalidate stats caches", description = "Drop every cached stats response")
    public Mono<ResponseEntity<Map<String, Object>>> invalidateAll() {
        log.info("Invalidating all stats caches");
        return Mono.fromRunnable(statsDataService::invalidateCaches)
                .thenReturn(ResponseEntity.ok(Map.<String, Object>of("message", "Stats caches invalidated")));
    }
}
