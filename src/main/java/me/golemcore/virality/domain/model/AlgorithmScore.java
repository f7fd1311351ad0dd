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

package me.golemcore.virality.domain.model;

import lombok.Builder;

/**
 * Score of one post produced by a single analysis.
 *
 * <p>
 * {@code compositeScore} is always {@link ScoreBreakdown#composite()} of the
 * carried breakdown, regardless of which strategy produced it.
 */
@Builder
public record AlgorithmScore(
        ScoreBreakdown breakdown,
        double compositeScore,
        double toxicityScore,
        double engagementScore,
        TweetFeatures features,
        ScoringStrategy strategyUsed) {

    /**
     * Builds a score whose toxicity and engagement are derived from the
     * breakdown, as the local heuristics define them.
     */
    public static AlgorithmScore fromBreakdown(ScoreBreakdown breakdown, TweetFeatures features,
            ScoringStrategy strategy) {
        return AlgorithmScore.builder()
                .breakdown(breakdown)
                .compositeScore(breakdown.composite())
                .toxicityScore(1.0 - breakdown.safetyScore())
                .engagementScore(breakdown.socialSignals())
                .features(features)
                .strategyUsed(strategy)
                .build();
    }

    public long scaledScore(ScoreCeiling ceiling) {
        return ceiling.scale(compositeScore);
    }
}
