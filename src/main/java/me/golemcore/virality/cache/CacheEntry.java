/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.virality.cache;

import lombok.Getter;

/**
 * Single cached value with its TTL and access statistics. Owned and mutated
 * exclusively by {@link InMemoryCacheStore} under its lock.
 */
@Getter
final class CacheEntry<V> {

    private final String key;
    private final V value;
    private final long createdAt;
    private final long ttlMs;
    private int hitCount;
    private long lastAccessedAt;

    CacheEntry(String key, V value, long createdAt, long ttlMs) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.ttlMs = ttlMs;
        this.lastAccessedAt = createdAt;
    }

    boolean isExpired(long now) {
        return now - createdAt >= ttlMs;
    }

    long ageAt(long now) {
        return now - createdAt;
    }

    void recordHit(long now) {
        hitCount++;
        lastAccessedAt = now;
    }
}
