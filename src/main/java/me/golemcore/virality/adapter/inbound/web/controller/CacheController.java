package me.golemcore.virality.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.virality.adapter.inbound.web.dto.ClearExpiredResponse;
import me.golemcore.virality.cache.CacheStore;
import me.golemcore.virality.domain.model.CacheEntrySummary;
import me.golemcore.virality.domain.model.CacheStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Cache administration: statistics, entry listing and eviction.
 */
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
@Slf4j
public class CacheController {

    private final CacheStore<Object> cacheStore;

    @GetMapping("/stats")
    public Mono<ResponseEntity<CacheStats>> getStats() {
        return Mono.just(ResponseEntity.ok(cacheStore.getStats()));
    }

    @GetMapping("/entries")
    public Mono<ResponseEntity<List<CacheEntrySummary>>> getEntries() {
        return Mono.just(ResponseEntity.ok(cacheStore.getEntries()));
    }

    /**
     * Remove a single entry.
     */
    @DeleteMapping("/entries/{key}")
    public Mono<ResponseEntity<Void>> deleteEntry(@PathVariable String key) {
        if (cacheStore.delete(key)) {
            return Mono.just(ResponseEntity.noContent().build());
        }
        return Mono.just(ResponseEntity.notFound().build());
    }

    /**
     * Remove every entry and reset the counters.
     */
    @DeleteMapping
    public Mono<ResponseEntity<Void>> clear() {
        cacheStore.clear();
        log.info("[Cache] Cleared by API request");
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/clear-expired")
    public Mono<ResponseEntity<ClearExpiredResponse>> clearExpired() {
        return Mono.just(ResponseEntity.ok(new ClearExpiredResponse(cacheStore.clearExpired())));
    }
}
