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

package me.golemcore.virality.domain.service;

import me.golemcore.virality.cache.CacheKeys;
import me.golemcore.virality.cache.CachePurpose;
import me.golemcore.virality.cache.ResilientCache;
import me.golemcore.virality.domain.model.TrendingData;
import me.golemcore.virality.domain.model.TrendingTopic;
import me.golemcore.virality.infrastructure.config.ViralityProperties;
import me.golemcore.virality.port.outbound.TrendingSourcePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Trending topics per region, cached for a short TTL. When the source fails a
 * small built-in set is served instead.
 */
@Service
@Slf4j
public class TrendingService {

    static final List<TrendingTopic> FALLBACK_TOPICS = List.of(
            new TrendingTopic("#Tech", 50000, TrendingTopic.Category.TECHNOLOGY, TrendingTopic.Sentiment.POSITIVE),
            new TrendingTopic("#Innovation", 30000, TrendingTopic.Category.TECHNOLOGY,
                    TrendingTopic.Sentiment.POSITIVE),
            new TrendingTopic("#AI", 25000, TrendingTopic.Category.TECHNOLOGY, TrendingTopic.Sentiment.POSITIVE));

    private static final Map<String, List<String>> RELATED_TERMS = Map.of(
            "ai", List.of("ai", "artificial", "intelligence", "machine", "learning", "ml"),
            "tech", List.of("tech", "technology", "software", "programming", "coding", "development"),
            "business", List.of("business", "startup", "entrepreneur", "marketing", "sales"),
            "web", List.of("web", "website", "development", "frontend", "backend", "fullstack"));

    private final TrendingSourcePort source;
    private final ResilientCache cache;
    private final Clock clock;
    private final String defaultRegion;

    public TrendingService(TrendingSourcePort source, ResilientCache cache, Clock clock,
            ViralityProperties properties) {
        this.source = source;
        this.cache = cache;
        this.clock = clock;
        this.defaultRegion = properties.getTrending().getDefaultRegion();
    }

    public TrendingData getTrendingTopics(String region) {
        String effective = resolveRegion(region);
        return cache.getOrCompute(CachePurpose.TRENDING, CacheKeys.trendingTopics(effective), TrendingData.class,
                () -> fetch(effective));
    }

    /**
     * Topics whose hashtag contains the keyword, or that share a related term
     * with it.
     */
    public List<TrendingTopic> getRelevantTopics(String keyword, String region) {
        List<TrendingTopic> topics = getTrendingTopics(region).topics();
        if (keyword == null || keyword.isBlank()) {
            return topics;
        }
        String keywordLower = keyword.toLowerCase(Locale.ROOT);
        return topics.stream()
                .filter(topic -> isRelevant(topic, keywordLower))
                .toList();
    }

    public List<String> getTopHashtags(int limit, String region) {
        return getTrendingTopics(region).topics().stream()
                .sorted(Comparator.comparingLong(TrendingTopic::tweetVolume).reversed())
                .limit(Math.max(0, limit))
                .map(TrendingTopic::hashtag)
                .toList();
    }

    private TrendingData fetch(String region) {
        try {
            List<TrendingTopic> topics = source.fetchTopics(region);
            log.debug("[Trending] Fetched {} topics for {}", topics.size(), region);
            return new TrendingData(topics, clock.instant(), region);
        } catch (RuntimeException e) {
            log.warn("[Trending] Source failed for {}, serving fallback topics: {}", region, e.getMessage());
            return new TrendingData(FALLBACK_TOPICS, clock.instant(), region);
        }
    }

    private String resolveRegion(String region) {
        if (region == null || region.isBlank()) {
            return defaultRegion != null && !defaultRegion.isBlank() ? defaultRegion : CacheKeys.DEFAULT_REGION;
        }
        return region.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isRelevant(TrendingTopic topic, String keywordLower) {
        String hashtagLower = topic.hashtag().toLowerCase(Locale.ROOT);
        if (hashtagLower.contains(keywordLower)) {
            return true;
        }
        return RELATED_TERMS.values().stream()
                .flatMap(List::stream)
                .anyMatch(term -> keywordLower.contains(term) && hashtagLower.contains(term));
    }
}
