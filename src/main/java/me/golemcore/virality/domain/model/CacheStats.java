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

package me.golemcore.virality.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of cache state, derived from live entries and the
 * cumulative hit/miss counters.
 *
 * <p>
 * {@code hitRate} is a fraction in {@code [0, 1]}; it is 0 when no lookups were
 * made. Entry ages are 0 when the cache is empty.
 */
@Value
@Builder
public class CacheStats {

    int totalEntries;
    long totalHits;
    long totalMisses;
    double hitRate;
    long oldestEntryAgeMs;
    long newestEntryAgeMs;

    public long getTotalRequests() {
        return totalHits + totalMisses;
    }
}
