package me.golemcore.virality.domain.service;

import me.golemcore.virality.cache.CacheKeys;
import me.golemcore.virality.cache.CacheTtlPolicy;
import me.golemcore.virality.cache.InMemoryCacheStore;
import me.golemcore.virality.cache.ResilientCache;
import me.golemcore.virality.domain.exception.InvalidInputException;
import me.golemcore.virality.domain.model.AbTestResult;
import me.golemcore.virality.domain.model.ImprovedVersion;
import me.golemcore.virality.domain.model.ScoreBreakdown;
import me.golemcore.virality.domain.model.ScoreCeiling;
import me.golemcore.virality.domain.model.TweetImprovements;
import me.golemcore.virality.domain.model.TweetVariant;
import me.golemcore.virality.infrastructure.config.ViralityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AbTestServiceTest {

    private static final String LAUNCH_POST = "Just launched our new AI feature! What do you think? #AI #Tech";

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC);

    private ContentInsightService insightService;
    private InMemoryCacheStore<Object> store;
    private AbTestService service;

    @BeforeEach
    void setUp() {
        insightService = mock(ContentInsightService.class);
        when(insightService.isAvailable()).thenReturn(false);
        store = new InMemoryCacheStore<>(clock, Duration.ZERO);
        ResilientCache cache = new ResilientCache(store, new CacheTtlPolicy(new ViralityProperties()));
        service = new AbTestService(new FeatureExtractor(), new ScoringEngine(clock), insightService, cache, clock);
    }

    @Test
    void runAbTest_defaultsToThreeVariantsFromTemplates() {
        AbTestResult result = service.runAbTest(LAUNCH_POST, null);

        List<TweetVariant> variants = result.getVariants();
        assertEquals(3, variants.size());
        assertEquals(List.of("original", "variant-1", "variant-2"),
                variants.stream().map(TweetVariant::id).toList());
        assertEquals(LAUNCH_POST, variants.get(0).text());
        assertEquals(LAUNCH_POST + " #Tech", variants.get(1).text());
        assertEquals(LAUNCH_POST + " What do you think?", variants.get(2).text());
        assertFalse(result.isGeneratedByLlm());
        assertEquals(0, result.getProcessingTimeMs());
    }

    @Test
    void runAbTest_scoresOnExtendedScale() {
        AbTestResult result = service.runAbTest(LAUNCH_POST, 2);

        TweetVariant original = result.getVariants().get(0);
        ScoreBreakdown breakdown = new ScoringEngine(clock)
                .score(new FeatureExtractor().extract(LAUNCH_POST, clock.millis()), clock.millis());
        assertEquals(ScoreCeiling.EXTENDED.scale(breakdown.composite()), original.score());
        assertEquals(62, original.characterCount());
        assertEquals(2, original.hashtagCount());
        assertTrue(result.getVariants().stream()
                .allMatch(variant -> variant.score() >= 0 && variant.score() <= ScoreCeiling.EXTENDED.getCeiling()));
    }

    @Test
    void runAbTest_picksHighestScoringVariant() {
        AbTestResult result = service.runAbTest(LAUNCH_POST, 6);

        TweetVariant best = result.getBestVariant();
        assertTrue(result.getVariants().stream().allMatch(variant -> variant.score() <= best.score()));
        long originalScore = result.getVariants().get(0).score();
        assertEquals((best.score() - originalScore) * 100.0 / originalScore, result.getImprovementPercent(), 1e-9);
        assertTrue(result.getImprovementPercent() >= 0.0);
    }

    @Test
    void runAbTest_rejectsOutOfRangeVariantCount() {
        assertThrows(InvalidInputException.class, () -> service.runAbTest(LAUNCH_POST, 1));
        assertThrows(InvalidInputException.class, () -> service.runAbTest(LAUNCH_POST, 7));
    }

    @Test
    void runAbTest_rejectsBlankText() {
        InvalidInputException error = assertThrows(InvalidInputException.class, () -> service.runAbTest("  ", 3));

        assertEquals("Original tweet text is required", error.getMessage());
    }

    @Test
    void runAbTest_cachesPerTextAndVariantCount() {
        AbTestResult first = service.runAbTest(LAUNCH_POST, 3);

        assertSame(first, service.runAbTest(LAUNCH_POST, 3));
        assertNotSame(first, service.runAbTest(LAUNCH_POST, 4));
        assertTrue(store.has(CacheKeys.abTest(LAUNCH_POST, 3)));
        assertTrue(store.has(CacheKeys.abTest(LAUNCH_POST, 4)));
    }

    @Test
    void runAbTest_usesCompletionVersionsWhenAvailable() {
        when(insightService.isAvailable()).thenReturn(true);
        when(insightService.analyzeContent(anyString())).thenReturn(Optional.empty());
        when(insightService.improve(anyString(), isNull())).thenReturn(Optional.of(new TweetImprovements(List.of(
                new ImprovedVersion("Shipped: our AI feature. Thoughts?", List.of(), 10, null),
                new ImprovedVersion(LAUNCH_POST, List.of(), 0, null),
                new ImprovedVersion("Our AI feature is live #AI", List.of(), 5, null)), List.of())));

        AbTestResult result = service.runAbTest(LAUNCH_POST, 3);

        assertTrue(result.isGeneratedByLlm());
        assertEquals(List.of(LAUNCH_POST, "Shipped: our AI feature. Thoughts?", "Our AI feature is live #AI"),
                result.getVariants().stream().map(TweetVariant::text).toList());
        verify(insightService, times(1)).improve(anyString(), isNull());
    }

    @Test
    void runAbTest_fallsBackToTemplatesWhenCompletionReturnsNothing() {
        when(insightService.isAvailable()).thenReturn(true);
        when(insightService.analyzeContent(anyString())).thenReturn(Optional.empty());
        when(insightService.improve(anyString(), isNull())).thenReturn(Optional.empty());

        AbTestResult result = service.runAbTest(LAUNCH_POST, 2);

        assertFalse(result.isGeneratedByLlm());
        assertEquals(LAUNCH_POST + " #Tech", result.getVariants().get(1).text());
    }

    @Test
    void templateCandidates_replacesTrailingPeriod() {
        List<String> candidates = AbTestService.templateCandidates("Done.", 6);

        assertEquals(List.of("Done. #Tech", "Done. What do you think?", "Done!", "🚀 Done.", "Breaking: Done."),
                candidates);
    }
}
