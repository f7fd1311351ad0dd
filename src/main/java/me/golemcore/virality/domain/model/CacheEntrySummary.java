package me.golemcore.virality.domain.model;

/**
 * Read-only view of one cache entry for administration.
 */
public record CacheEntrySummary(String key, long ageMs, int hits, long ttlMs) {
}
