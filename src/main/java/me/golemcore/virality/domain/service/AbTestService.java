package me.golemcore.virality.domain.service;

import me.golemcore.virality.cache.CacheKeys;
import me.golemcore.virality.cache.CachePurpose;
import me.golemcore.virality.cache.ResilientCache;
import me.golemcore.virality.domain.exception.InvalidInputException;
import me.golemcore.virality.domain.model.AbTestResult;
import me.golemcore.virality.domain.model.AnalysisFactors;
import me.golemcore.virality.domain.model.ContentInsight;
import me.golemcore.virality.domain.model.ImprovedVersion;
import me.golemcore.virality.domain.model.ScoreBreakdown;
import me.golemcore.virality.domain.model.ScoreCeiling;
import me.golemcore.virality.domain.model.TweetFeatures;
import me.golemcore.virality.domain.model.TweetVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compares a post against rewritten variants, all scored locally on the
 * extended 0-500 scale.
 *
 * <p>
 * Variants come from the completion API when it is available, otherwise from
 * fixed templates. Results are cached per text and variant count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AbTestService {

    public static final int DEFAULT_VARIANTS = 3;
    public static final int MIN_VARIANTS = 2;
    public static final int MAX_VARIANTS = 6;

    static final String ORIGINAL_ID = "original";

    private final FeatureExtractor featureExtractor;
    private final ScoringEngine scoringEngine;
    private final ContentInsightService insightService;
    private final ResilientCache cache;
    private final Clock clock;

    public AbTestResult runAbTest(String originalTweet, Integer numVariants) {
        if (originalTweet == null || originalTweet.isBlank()) {
            throw new InvalidInputException("Original tweet text is required");
        }
        int count = numVariants != null ? numVariants : DEFAULT_VARIANTS;
        if (count < MIN_VARIANTS || count > MAX_VARIANTS) {
            throw new InvalidInputException(
                    "numVariants must be between " + MIN_VARIANTS + " and " + MAX_VARIANTS);
        }
        return cache.getOrCompute(CachePurpose.AB_TEST, CacheKeys.abTest(originalTweet, count), AbTestResult.class,
                () -> compute(originalTweet, count));
    }

    private AbTestResult compute(String originalTweet, int count) {
        long startedAt = clock.millis();

        List<String> candidates = generatedCandidates(originalTweet, count);
        boolean generatedByLlm = !candidates.isEmpty();
        if (!generatedByLlm) {
            candidates = templateCandidates(originalTweet, count);
        }

        List<TweetVariant> variants = new ArrayList<>();
        TweetVariant original = scoreVariant(ORIGINAL_ID, originalTweet);
        variants.add(original);
        for (int i = 0; i < candidates.size(); i++) {
            variants.add(scoreVariant("variant-" + (i + 1), candidates.get(i)));
        }

        TweetVariant best = original;
        for (TweetVariant variant : variants) {
            if (variant.score() > best.score()) {
                best = variant;
            }
        }
        double improvement = original.score() > 0
                ? (best.score() - original.score()) * 100.0 / original.score()
                : 0.0;

        log.debug("[API] A/B test scored {} variants, best {} ({})", variants.size(), best.id(), best.score());
        return AbTestResult.builder()
                .originalTweet(originalTweet)
                .variants(variants)
                .bestVariant(best)
                .improvementPercent(improvement)
                .generatedByLlm(generatedByLlm)
                .processingTimeMs(Math.max(0, clock.millis() - startedAt))
                .build();
    }

    private List<String> generatedCandidates(String originalTweet, int count) {
        if (!insightService.isAvailable()) {
            return List.of();
        }
        Optional<ContentInsight> insight = insightService.analyzeContent(originalTweet);
        return insightService.improve(originalTweet, insight.orElse(null))
                .map(improvements -> distinct(originalTweet, improvements.improvedVersions().stream()
                        .map(ImprovedVersion::text)
                        .toList(), count - 1))
                .orElse(List.of());
    }

    static List<String> templateCandidates(String originalTweet, int count) {
        List<String> templates = List.of(
                originalTweet + " #Tech",
                originalTweet + " What do you think?",
                originalTweet.endsWith(".")
                        ? originalTweet.substring(0, originalTweet.length() - 1) + "!"
                        : originalTweet + "!",
                "🚀 " + originalTweet,
                "Breaking: " + originalTweet);
        return distinct(originalTweet, templates, count - 1);
    }

    private static List<String> distinct(String originalTweet, List<String> candidates, int limit) {
        Set<String> unique = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (unique.size() >= limit) {
                break;
            }
            if (candidate != null && !candidate.isBlank() && !candidate.equals(originalTweet)) {
                unique.add(candidate);
            }
        }
        return new ArrayList<>(unique);
    }

    private TweetVariant scoreVariant(String id, String text) {
        long now = clock.millis();
        TweetFeatures features = featureExtractor.extract(text, now);
        ScoreBreakdown breakdown = scoringEngine.score(features, now);
        return TweetVariant.builder()
                .id(id)
                .text(text)
                .score(ScoreCeiling.EXTENDED.scale(breakdown.composite()))
                .factors(AnalysisFactors.of(breakdown, features))
                .characterCount(features.length())
                .hashtagCount(features.hashtagCount())
                .mentionCount(features.mentionCount())
                .build();
    }
}
