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
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * In-process {@link CacheStore} backed by a hash map.
 *
 * <p>
 * Every operation holds the store's monitor for its duration, so reads, writes
 * and the expiry sweep never interleave. There is no per-key locking:
 * {@link #getOrSet} computes outside the lock and tolerates duplicate work.
 *
 * <p>
 * A background sweep calling {@link #clearExpired()} is started on
 * construction when {@code sweepInterval} is positive, and stopped by
 * {@link #shutdown()}. Time is read from the injected {@link Clock}.
 *
 * @param <V>
 *            value type
 */
@Slf4j
public class InMemoryCacheStore<V> implements CacheStore<V> {

    private final Clock clock;
    private final Map<String, CacheEntry<V>> entries = new HashMap<>();
    private final ScheduledExecutorService sweeper;
    private final ScheduledFuture<?> sweepTask;

    private long hits;
    private long misses;

    public InMemoryCacheStore(Clock clock, Duration sweepInterval) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            this.sweeper = null;
            this.sweepTask = null;
            log.debug("[Cache] Background sweep disabled");
            return;
        }
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-expiry-sweep");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = sweepInterval.toMillis();
        this.sweepTask = sweeper.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Cache] Started expiry sweep every {}ms", intervalMs);
    }

    @Override
    public synchronized Optional<V> get(String key) {
        long now = clock.millis();
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(now)) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        entry.recordHit(now);
        hits++;
        return Optional.of(entry.getValue());
    }

    @Override
    public synchronized void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative: " + ttl);
        }
        entries.put(key, new CacheEntry<>(key, value, clock.millis(), ttl.toMillis()));
    }

    @Override
    public synchronized boolean has(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            return false;
        }
        return true;
    }

    @Override
    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    @Override
    public synchronized int clearExpired() {
        long now = clock.millis();
        int cleared = 0;
        Iterator<CacheEntry<V>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
                cleared++;
            }
        }
        return cleared;
    }

    @Override
    public V getOrSet(String key, Duration ttl, Supplier<? extends V> compute) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = compute.get();
        if (value != null) {
            set(key, value, ttl);
        }
        return value;
    }

    @Override
    public synchronized CacheStats getStats() {
        long now = clock.millis();
        long total = hits + misses;
        long oldestAge = 0;
        long newestAge = entries.isEmpty() ? 0 : Long.MAX_VALUE;
        for (CacheEntry<V> entry : entries.values()) {
            long age = entry.ageAt(now);
            oldestAge = Math.max(oldestAge, age);
            newestAge = Math.min(newestAge, age);
        }
        return CacheStats.builder()
                .totalEntries(entries.size())
                .totalHits(hits)
                .totalMisses(misses)
                .hitRate(total > 0 ? (double) hits / total : 0.0)
                .oldestEntryAgeMs(oldestAge)
                .newestEntryAgeMs(newestAge)
                .build();
    }

    @Override
    public synchronized List<CacheEntrySummary> getEntries() {
        long now = clock.millis();
        List<CacheEntrySummary> summaries = new ArrayList<>(entries.size());
        for (CacheEntry<V> entry : entries.values()) {
            summaries.add(new CacheEntrySummary(entry.getKey(), entry.ageAt(now), entry.getHitCount(),
                    entry.getTtlMs()));
        }
        return summaries;
    }

    /**
     * Stops the background sweep. Entries remain readable afterwards.
     */
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (sweeper != null) {
            sweeper.shutdown();
            try {
                if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweeper.shutdownNow();
                }
            } catch (InterruptedException e) {
                sweeper.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("[Cache] Expiry sweep stopped");
        }
    }

    private void sweep() {
        try {
            int cleared = clearExpired();
            if (cleared > 0) {
                log.info("[Cache] Sweep removed {} expired entries", cleared);
            }
        } catch (RuntimeException e) {
            // keep the schedule alive; the next tick retries
            log.error("[Cache] Expiry sweep failed", e);
        }
    }
}
