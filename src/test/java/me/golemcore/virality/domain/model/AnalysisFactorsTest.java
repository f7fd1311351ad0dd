package me.golemcore.virality.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AnalysisFactorsTest {

    @Test
    void of_convertsBreakdownToPercentFactors() {
        ScoreBreakdown breakdown = new ScoreBreakdown(0.76, 0.6, 0.9, 0.7, 1.0);
        TweetFeatures features = TweetFeatures.builder().hashtagCount(7).mentionCount(1).build();

        AnalysisFactors factors = AnalysisFactors.of(breakdown, features);

        assertEquals(new AnalysisFactors(60, 90, 76, 40, 80), factors);
    }

    @Test
    void mentionFactor_favorsOneOrTwoMentions() {
        assertEquals(60, AnalysisFactors.mentionFactor(0));
        assertEquals(80, AnalysisFactors.mentionFactor(2));
        assertEquals(60, AnalysisFactors.mentionFactor(4));
        assertEquals(35, AnalysisFactors.mentionFactor(5));
    }
}
