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

import me.golemcore.virality.domain.exception.CacheException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Typed read-through access to the shared {@link CacheStore}, resolving TTLs
 * by {@link CachePurpose}.
 *
 * <p>
 * A {@link CacheException} from the store is logged and treated as a miss;
 * failures of {@code compute} propagate unchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResilientCache {

    private final CacheStore<Object> store;
    private final CacheTtlPolicy ttlPolicy;

    public <T> T getOrCompute(CachePurpose purpose, String key, Class<T> type, Supplier<T> compute) {
        try {
            Object value = store.getOrSet(key, ttlPolicy.ttlFor(purpose), compute);
            if (value != null && !type.isInstance(value)) {
                log.warn("[Cache] Entry {} holds {}, expected {}; recomputing", key,
                        value.getClass().getSimpleName(), type.getSimpleName());
                return compute.get();
            }
            return type.cast(value);
        } catch (CacheException e) {
            log.warn("[Cache] Store unavailable for {}, computing directly: {}", key, e.getMessage());
            return compute.get();
        }
    }
}
