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

import me.golemcore.virality.infrastructure.config.ViralityProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Resolves the TTL for each {@link CachePurpose}, honoring
 * {@code virality.cache.ttl.*} overrides.
 */
@Component
@RequiredArgsConstructor
public class CacheTtlPolicy {

    private final ViralityProperties properties;

    public Duration ttlFor(CachePurpose purpose) {
        ViralityProperties.TtlProperties ttl = properties.getCache().getTtl();
        Duration configured = switch (purpose) {
        case ANALYSIS -> ttl.getAnalysis();
        case INSIGHT -> ttl.getInsight();
        case SUGGESTIONS -> ttl.getSuggestions();
        case HASHTAGS -> ttl.getHashtags();
        case TRENDING -> ttl.getTrending();
        case AB_TEST -> ttl.getAbTest();
        };
        return configured != null ? configured : purpose.getDefaultTtl();
    }
}
