package me.golemcore.virality.domain.model;

import lombok.Builder;

/**
 * Actionable suggestion derived from a score.
 *
 * @param expectedImprovement
 *            estimated score gain, in points on the 0-100 scale
 */
@Builder
public record AlgorithmSuggestion(
        SuggestionType type,
        SuggestionPriority priority,
        String text,
        int expectedImprovement) {
}
