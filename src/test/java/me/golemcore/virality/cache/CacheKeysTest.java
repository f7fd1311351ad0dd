package me.golemcore.virality.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    private static final String TEXT = "Just launched our new AI feature! What do you think? #AI #Tech";

    @Test
    void hash_isStableAndBase36() {
        String hash = CacheKeys.hash(TEXT);

        assertEquals(hash, CacheKeys.hash(TEXT));
        assertTrue(hash.matches("[0-9a-z]+"));
    }

    @Test
    void hash_matchesFnv1a64ReferenceValues() {
        assertEquals(Long.toUnsignedString(0xaf63dc4c8601ec8cL, 36), CacheKeys.hash("a"));
        assertEquals(Long.toUnsignedString(0xcbf29ce484222325L, 36), CacheKeys.hash(""));
    }

    @Test
    void hash_isCaseAndWhitespaceSensitive() {
        assertNotEquals(CacheKeys.hash("Hello world"), CacheKeys.hash("hello world"));
        assertNotEquals(CacheKeys.hash("Hello world"), CacheKeys.hash("Hello  world"));
    }

    @Test
    void hash_separatesTextsWithEqualStringHashCodes() {
        assertEquals("Aa".hashCode(), "BB".hashCode());
        assertEquals("Hate this. Aa".hashCode(), "Hate this. BB".hashCode());

        assertNotEquals(CacheKeys.hash("Aa"), CacheKeys.hash("BB"));
        assertNotEquals(CacheKeys.tweetAnalysis("Hate this. Aa"), CacheKeys.tweetAnalysis("Hate this. BB"));
    }

    @Test
    void keys_carryPurposePrefix() {
        String hash = CacheKeys.hash(TEXT);

        assertEquals("tweet-analysis-" + hash, CacheKeys.tweetAnalysis(TEXT));
        assertEquals("tweet-insight-" + hash, CacheKeys.tweetInsight(TEXT));
        assertEquals("hashtag-suggestions-" + hash, CacheKeys.hashtagSuggestions(TEXT));
        assertEquals("ab-test-" + hash + "-3", CacheKeys.abTest(TEXT, 3));
    }

    @Test
    void keys_appendOptionalFragment() {
        String hash = CacheKeys.hash(TEXT);

        assertEquals("tweet-analysis-" + hash + "-ctx", CacheKeys.tweetAnalysis(TEXT, "ctx"));
        assertEquals("tweet-analysis-" + hash, CacheKeys.tweetAnalysis(TEXT, null));
        assertEquals("tweet-suggestions-" + hash + "-abc", CacheKeys.tweetSuggestions(TEXT, "abc"));
        assertEquals("tweet-suggestions-" + hash, CacheKeys.tweetSuggestions(TEXT, " "));
    }

    @Test
    void trendingTopics_defaultsToUsRegion() {
        assertEquals("trending-topics-US", CacheKeys.trendingTopics(null));
        assertEquals("trending-topics-US", CacheKeys.trendingTopics(""));
        assertEquals("trending-topics-GB", CacheKeys.trendingTopics("GB"));
    }
}
