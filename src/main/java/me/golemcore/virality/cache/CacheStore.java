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

import me.golemcore.virality.domain.model.CacheEntrySummary;
import me.golemcore.virality.domain.model.CacheStats;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Key-value store with per-entry time-to-live and access statistics.
 *
 * <p>
 * An entry is expired once its age reaches its TTL; expired entries behave as
 * absent for every read operation. Implementations must be safe for concurrent
 * use. A backing-store failure is reported as
 * {@link me.golemcore.virality.domain.exception.CacheException}.
 *
 * @param <V>
 *            value type
 */
public interface CacheStore<V> {

    /**
     * Returns the live value for the key, counting a hit or a miss. Expired
     * entries are evicted on read.
     */
    Optional<V> get(String key);

    /**
     * Inserts or replaces an entry, resetting its age and hit count.
     */
    void set(String key, V value, Duration ttl);

    /**
     * Checks whether a live entry exists without touching hit/miss counters or
     * access times.
     */
    boolean has(String key);

    boolean delete(String key);

    /**
     * Removes all entries and resets the cumulative counters.
     */
    void clear();

    /**
     * Evicts every expired entry.
     *
     * @return number of evicted entries
     */
    int clearExpired();

    /**
     * Returns the cached value, or computes, stores and returns it on a miss.
     * {@code compute} runs outside any lock: concurrent misses on the same key
     * may each compute. A {@code null} result is returned but not stored.
     */
    V getOrSet(String key, Duration ttl, Supplier<? extends V> compute);

    CacheStats getStats();

    List<CacheEntrySummary> getEntries();
}
