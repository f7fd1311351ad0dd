package me.golemcore.virality.domain.service;

import me.golemcore.virality.domain.exception.InvalidInputException;
import me.golemcore.virality.domain.model.ContentInsight;
import me.golemcore.virality.domain.model.HashtagSuggestions;
import me.golemcore.virality.domain.model.ImprovedVersion;
import me.golemcore.virality.domain.model.ImprovementSuggestion;
import me.golemcore.virality.domain.model.TweetImprovements;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImprovementServiceTest {

    private static final String PLAIN_POST = "Working on some exciting updates. Stay tuned!";

    private ContentInsightService insightService;
    private ImprovementService service;

    @BeforeEach
    void setUp() {
        insightService = mock(ContentInsightService.class);
        when(insightService.isAvailable()).thenReturn(false);
        service = new ImprovementService(insightService);
    }

    @Test
    void suggest_appliesRuleChainToPlainPost() {
        ImprovementSuggestion suggestion = service.suggest(PLAIN_POST);

        assertEquals(PLAIN_POST, suggestion.getOriginal());
        assertEquals(List.of("Added engagement question", "Added engagement starter phrase",
                "Added trending hashtags for discoverability"), suggestion.getChanges());
        assertEquals(24, suggestion.getExpectedScoreIncrease());
        assertTrue(suggestion.getImproved().contains("What are your thoughts?"));
        assertTrue(suggestion.getImproved().endsWith("#AI #Tech"));
        assertTrue(suggestion.getImprovedVersions().isEmpty());
        assertNull(suggestion.getHashtagSuggestions());
        verify(insightService, never()).analyzeContent(anyString());
    }

    @Test
    void suggest_isDeterministic() {
        assertEquals(service.suggest(PLAIN_POST).getImproved(), service.suggest(PLAIN_POST).getImproved());
    }

    @Test
    void suggest_capsExpectedIncrease() {
        ImprovementSuggestion suggestion = service.suggest("this is cool");

        assertTrue(suggestion.getChanges().size() >= 4);
        assertEquals(ImprovementService.MAX_EXPECTED_SCORE_INCREASE, suggestion.getExpectedScoreIncrease());
    }

    @Test
    void suggest_rejectsBlankText() {
        assertThrows(InvalidInputException.class, () -> service.suggest(" "));
    }

    @Test
    void improveEngagement_addsPowerWordToThisIs() {
        List<String> changes = new ArrayList<>();

        String improved = service.improveEngagement("Honestly this is the best release yet?", changes);

        assertEquals("Honestly This is incredible the best release yet?", improved);
        assertEquals(List.of("Added emotional impact word"), changes);
    }

    @Test
    void improveEngagement_keepsExistingQuestion() {
        List<String> changes = new ArrayList<>();

        assertEquals("Ready?", service.improveEngagement("Ready?", changes));
        assertTrue(changes.isEmpty());
    }

    @Test
    void improveStructure_skipsLongPostsAndExistingStarters() {
        List<String> changes = new ArrayList<>();
        String longPost = "x".repeat(150);

        assertEquals(longPost, service.improveStructure(longPost, changes));
        assertEquals("Hot take: tabs win", service.improveStructure("Hot take: tabs win", changes));
        assertTrue(changes.isEmpty());
    }

    @Test
    void improveStructure_preservesAcronymCase() {
        String improved = service.improveStructure("AI is changing everything", new ArrayList<>());

        assertTrue(improved.endsWith(" AI is changing everything"));
    }

    @Test
    void improveHashtags_trimsToFirstThree() {
        List<String> changes = new ArrayList<>();

        String improved = service.improveHashtags("Big news #a #b #c #d #e today", changes);

        assertEquals("Big news #a #b #c today", improved);
        assertEquals(List.of("Reduced hashtags to optimal number (1-3)"), changes);
    }

    @Test
    void improveHashtags_leavesOptimalCountAlone() {
        List<String> changes = new ArrayList<>();

        assertEquals("Ship it #dev", service.improveHashtags("Ship it #dev", changes));
        assertTrue(changes.isEmpty());
    }

    @Test
    void optimizeLength_condensesLongPosts() {
        List<String> changes = new ArrayList<>();

        String improved = service.optimizeLength("a".repeat(300), changes);

        assertEquals(243, improved.length());
        assertTrue(improved.endsWith("..."));
        assertEquals(List.of("Condensed tweet to optimal length"), changes);
    }

    @Test
    void optimizeLength_keepsSurrogatePairsWhole() {
        List<String> changes = new ArrayList<>();
        String text = "a".repeat(239) + "🚀" + "b".repeat(30);

        String improved = service.optimizeLength(text, changes);

        assertEquals("a".repeat(239) + "...", improved);
        assertFalse(improved.chars().anyMatch(c -> Character.isSurrogate((char) c)));
    }

    @Test
    void optimizeLength_addsContextToShortPosts() {
        List<String> changes = new ArrayList<>();

        assertEquals("Short post Here's why this matters:", service.optimizeLength("Short post", changes));
        assertEquals("Short because reasons", service.optimizeLength("Short because reasons", new ArrayList<>()));
    }

    @Test
    void suggest_addsCompletionEnrichmentWhenAvailable() {
        ContentInsight insight = ContentInsight.builder().viralityScore(50).build();
        ImprovedVersion version = new ImprovedVersion("Better post?", List.of("Added question"), 12, "Invites replies");
        HashtagSuggestions hashtags = new HashtagSuggestions(List.of("#Tech"), List.of("#Dev"), List.of("#AMA"));
        when(insightService.isAvailable()).thenReturn(true);
        when(insightService.analyzeContent(PLAIN_POST)).thenReturn(Optional.of(insight));
        when(insightService.improve(PLAIN_POST, insight))
                .thenReturn(Optional.of(new TweetImprovements(List.of(version), List.of("Post a demo video"))));
        when(insightService.suggestHashtags(PLAIN_POST)).thenReturn(Optional.of(hashtags));

        ImprovementSuggestion suggestion = service.suggest(PLAIN_POST);

        assertEquals(List.of(version), suggestion.getImprovedVersions());
        assertEquals(List.of("Post a demo video"), suggestion.getAlternativeApproaches());
        assertEquals(hashtags, suggestion.getHashtagSuggestions());
    }

    @Test
    void suggest_keepsRuleBasedResultWhenCompletionFails() {
        when(insightService.isAvailable()).thenReturn(true);
        when(insightService.analyzeContent(anyString())).thenReturn(Optional.empty());
        when(insightService.improve(anyString(), any())).thenReturn(Optional.empty());
        when(insightService.suggestHashtags(anyString())).thenReturn(Optional.empty());

        ImprovementSuggestion suggestion = service.suggest(PLAIN_POST);

        assertEquals(3, suggestion.getChanges().size());
        assertTrue(suggestion.getImprovedVersions().isEmpty());
        assertNull(suggestion.getHashtagSuggestions());
    }
}
