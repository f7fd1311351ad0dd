package me.golemcore.virality.domain.model;

import lombok.Builder;

/**
 * One candidate in an A/B comparison, scored on the
 * {@link ScoreCeiling#EXTENDED} scale.
 */
@Builder
public record TweetVariant(
        String id,
        String text,
        long score,
        AnalysisFactors factors,
        int characterCount,
        int hashtagCount,
        int mentionCount) {
}
