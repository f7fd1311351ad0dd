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

import me.golemcore.virality.domain.model.ContentInsight;
import me.golemcore.virality.domain.model.ImprovementSuggestion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a post with a fixed chain of rules (engagement, structure,
 * hashtags, length), then enriches the result with completion-based versions
 * when the completion API is available.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImprovementService {

    static final int SCORE_INCREASE_PER_CHANGE = 8;
    static final int MAX_EXPECTED_SCORE_INCREASE = 25;

    private static final List<String> POWER_WORDS = List.of(
            "breaking", "exclusive", "revealed", "secret", "hidden", "shocking", "amazing",
            "incredible", "unbelievable", "mind-blowing", "game-changing");

    private static final List<String> ENGAGEMENT_STARTERS = List.of(
            "What do you think about", "Unpopular opinion:", "Hot take:", "Am I the only one who",
            "Can we talk about", "Here's why");

    private static final List<String> DEFAULT_HASHTAGS = List.of("#AI", "#Tech");

    private static final Pattern HASHTAG_PATTERN = Pattern.compile("#\\w+");
    private static final Pattern THIS_IS_PATTERN = Pattern.compile("this is", Pattern.CASE_INSENSITIVE);
    private static final int MAX_KEPT_HASHTAGS = 3;
    private static final int SHORT_POST_LENGTH = 80;
    private static final int LONG_POST_LENGTH = 250;
    private static final int CONDENSED_LENGTH = 240;

    private final ContentInsightService insightService;

    public ImprovementSuggestion suggest(String text) {
        FallbackOrchestrator.validate(text);

        List<String> changes = new ArrayList<>();
        String improved = improveEngagement(text, changes);
        improved = improveStructure(improved, changes);
        improved = improveHashtags(improved, changes);
        improved = optimizeLength(improved, changes);

        ImprovementSuggestion.ImprovementSuggestionBuilder builder = ImprovementSuggestion.builder()
                .original(text)
                .improved(improved.trim())
                .changes(changes)
                .expectedScoreIncrease(Math.min(changes.size() * SCORE_INCREASE_PER_CHANGE,
                        MAX_EXPECTED_SCORE_INCREASE));

        if (insightService.isAvailable()) {
            Optional<ContentInsight> insight = insightService.analyzeContent(text);
            insightService.improve(text, insight.orElse(null)).ifPresent(improvements -> builder
                    .improvedVersions(improvements.improvedVersions())
                    .alternativeApproaches(improvements.alternativeApproaches()));
            insightService.suggestHashtags(text).ifPresent(builder::hashtagSuggestions);
        } else {
            log.debug("[Insight] Completion API not configured, rule-based improvements only");
        }
        return builder.build();
    }

    String improveEngagement(String text, List<String> changes) {
        String improved = text;
        String lower = text.toLowerCase(Locale.ROOT);
        if (!text.contains("?") && !lower.contains("thoughts")) {
            improved += " What are your thoughts?";
            changes.add("Added engagement question");
        }

        boolean hasPowerWord = POWER_WORDS.stream().anyMatch(lower::contains);
        if (!hasPowerWord && improved.length() < 200) {
            Matcher matcher = THIS_IS_PATTERN.matcher(improved);
            if (matcher.find()) {
                improved = improved.substring(0, matcher.start()) + "This is incredible"
                        + improved.substring(matcher.end());
                changes.add("Added emotional impact word");
            }
        }
        return improved;
    }

    /**
     * Prefixes an engagement starter. The starter is picked from the text's hash
     * so the same post always gets the same rewrite.
     */
    String improveStructure(String text, List<String> changes) {
        String lower = text.toLowerCase(Locale.ROOT);
        boolean hasStarter = ENGAGEMENT_STARTERS.stream()
                .anyMatch(starter -> lower.contains(starter.toLowerCase(Locale.ROOT)));
        if (hasStarter || text.length() >= 150) {
            return text;
        }
        String starter = ENGAGEMENT_STARTERS.get(Math.floorMod(text.hashCode(), ENGAGEMENT_STARTERS.size()));
        changes.add("Added engagement starter phrase");
        return starter + " " + decapitalize(text);
    }

    String improveHashtags(String text, List<String> changes) {
        Matcher matcher = HASHTAG_PATTERN.matcher(text);
        List<int[]> spans = new ArrayList<>();
        while (matcher.find()) {
            spans.add(new int[] {matcher.start(), matcher.end()});
        }

        if (spans.isEmpty()) {
            changes.add("Added trending hashtags for discoverability");
            return text + " " + String.join(" ", DEFAULT_HASHTAGS);
        }
        if (spans.size() > MAX_KEPT_HASHTAGS) {
            StringBuilder kept = new StringBuilder(text);
            for (int i = spans.size() - 1; i >= MAX_KEPT_HASHTAGS; i--) {
                kept.delete(spans.get(i)[0], spans.get(i)[1]);
            }
            changes.add("Reduced hashtags to optimal number (1-3)");
            return kept.toString().replaceAll("\\s+", " ").trim();
        }
        return text;
    }

    String optimizeLength(String text, List<String> changes) {
        if (text.length() < SHORT_POST_LENGTH) {
            String lower = text.toLowerCase(Locale.ROOT);
            if (!lower.contains("because") && !lower.contains("here's why")) {
                changes.add("Added context to increase length and engagement");
                return text + " Here's why this matters:";
            }
        } else if (text.length() > LONG_POST_LENGTH) {
            changes.add("Condensed tweet to optimal length");
            int end = CONDENSED_LENGTH;
            // Do not split a surrogate pair.
            if (Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            return text.substring(0, end) + "...";
        }
        return text;
    }

    private static String decapitalize(String text) {
        if (text.isEmpty() || text.startsWith("#") || text.startsWith("@")) {
            return text;
        }
        // Leave acronyms such as "AI" alone.
        if (text.length() > 1 && Character.isUpperCase(text.charAt(1))) {
            return text;
        }
        return Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }
}
