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

import java.time.Duration;

/**
 * What a cache entry holds. Determines the key prefix and the default TTL.
 */
public enum CachePurpose {

    ANALYSIS("tweet-analysis-", Duration.ofMinutes(30)),
    INSIGHT("tweet-insight-", Duration.ofMinutes(30)),
    SUGGESTIONS("tweet-suggestions-", Duration.ofMinutes(15)),
    HASHTAGS("hashtag-suggestions-", Duration.ofMinutes(10)),
    TRENDING("trending-topics-", Duration.ofMinutes(5)),
    AB_TEST("ab-test-", Duration.ofMinutes(10));

    private final String prefix;
    private final Duration defaultTtl;

    CachePurpose(String prefix, Duration defaultTtl) {
        this.prefix = prefix;
        this.defaultTtl = defaultTtl;
    }

    public String getPrefix() {
        return prefix;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
