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

import me.golemcore.virality.domain.model.AlgorithmScore;
import me.golemcore.virality.domain.model.AlgorithmSuggestion;
import me.golemcore.virality.domain.model.HashtagBand;
import me.golemcore.virality.domain.model.ScoreBreakdown;
import me.golemcore.virality.domain.model.SuggestionPriority;
import me.golemcore.virality.domain.model.SuggestionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based suggestions from a completed score.
 *
 * <p>
 * Output order is fixed: content, engagement, hashtags, timing, safety. Only
 * crossed thresholds produce a suggestion.
 */
@Component
public class SuggestionGenerator {

    static final double CONTENT_QUALITY_THRESHOLD = 0.6;
    static final double SOCIAL_SIGNALS_THRESHOLD = 0.5;
    static final double TIMING_THRESHOLD = 0.7;
    static final double SAFETY_THRESHOLD = 0.7;

    public List<AlgorithmSuggestion> suggest(AlgorithmScore score) {
        ScoreBreakdown breakdown = score.breakdown();
        List<AlgorithmSuggestion> suggestions = new ArrayList<>();

        if (breakdown.contentQuality() < CONTENT_QUALITY_THRESHOLD) {
            suggestions.add(suggestion(SuggestionType.CONTENT, SuggestionPriority.HIGH,
                    "Improve content quality by adding more engaging language or expanding the post", 15));
        }

        if (breakdown.socialSignals() < SOCIAL_SIGNALS_THRESHOLD) {
            suggestions.add(suggestion(SuggestionType.ENGAGEMENT, SuggestionPriority.HIGH,
                    "Add a question or call-to-action to encourage replies and engagement", 20));
        }

        HashtagBand band = score.features().hashtagBand();
        if (band == HashtagBand.NONE) {
            suggestions.add(suggestion(SuggestionType.HASHTAGS, SuggestionPriority.MEDIUM,
                    "Add 1-3 relevant hashtags to increase discoverability", 10));
        } else if (band == HashtagBand.HEAVY || band == HashtagBand.EXCESSIVE) {
            suggestions.add(suggestion(SuggestionType.HASHTAGS,
                    band == HashtagBand.EXCESSIVE ? SuggestionPriority.HIGH : SuggestionPriority.MEDIUM,
                    "Reduce hashtags to 1-3 for better performance", 10));
        }

        if (breakdown.timing() < TIMING_THRESHOLD) {
            suggestions.add(suggestion(SuggestionType.TIMING, SuggestionPriority.MEDIUM,
                    "Consider posting during peak hours (9-10 AM, 12-1 PM, 5-6 PM, 7-9 PM)", 10));
        }

        if (breakdown.safetyScore() < SAFETY_THRESHOLD) {
            suggestions.add(suggestion(SuggestionType.SAFETY, SuggestionPriority.HIGH,
                    "Reduce potentially offensive language to improve content safety score", 25));
        }

        return suggestions;
    }

    private static AlgorithmSuggestion suggestion(SuggestionType type, SuggestionPriority priority, String text,
            int expectedImprovement) {
        return AlgorithmSuggestion.builder()
                .type(type)
                .priority(priority)
                .text(text)
                .expectedImprovement(expectedImprovement)
                .build();
    }
}
