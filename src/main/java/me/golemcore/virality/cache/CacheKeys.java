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

/**
 * Derives cache keys from post text.
 *
 * <p>
 * Keys are a purpose prefix followed by a base-36 rendering of the 64-bit
 * FNV-1a hash of the text's UTF-16 code units. The hash is case-sensitive and
 * whitespace-preserving, and stable across runs.
 */
public final class CacheKeys {

    public static final String DEFAULT_REGION = "US";

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private CacheKeys() {
    }

    public static String hash(String text) {
        long hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < text.length(); i++) {
            hash ^= text.charAt(i);
            hash *= FNV_PRIME;
        }
        return Long.toUnsignedString(hash, 36);
    }

    public static String tweetAnalysis(String text) {
        return CachePurpose.ANALYSIS.getPrefix() + hash(text);
    }

    /**
     * Analysis key scoped to an additional context, such as author metadata.
     */
    public static String tweetAnalysis(String text, String contextHash) {
        return withFragment(tweetAnalysis(text), contextHash);
    }

    public static String tweetInsight(String text) {
        return CachePurpose.INSIGHT.getPrefix() + hash(text);
    }

    public static String tweetSuggestions(String text, String analysisHashFragment) {
        return withFragment(CachePurpose.SUGGESTIONS.getPrefix() + hash(text), analysisHashFragment);
    }

    public static String hashtagSuggestions(String text) {
        return CachePurpose.HASHTAGS.getPrefix() + hash(text);
    }

    public static String trendingTopics(String region) {
        String effective = region == null || region.isBlank() ? DEFAULT_REGION : region;
        return CachePurpose.TRENDING.getPrefix() + effective;
    }

    public static String abTest(String text, int numVariants) {
        return CachePurpose.AB_TEST.getPrefix() + hash(text) + "-" + numVariants;
    }

    private static String withFragment(String key, String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return key;
        }
        return key + "-" + fragment;
    }
}
