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
 * Per-factor view of a score, each on a 0-100 scale.
 */
@Builder
public record AnalysisFactors(int engagement, int timing, int content, int hashtags, int mentions) {

    public static AnalysisFactors of(ScoreBreakdown breakdown, TweetFeatures features) {
        return AnalysisFactors.builder()
                .engagement((int) ScoreCeiling.PERCENT.scale(breakdown.socialSignals()))
                .timing((int) ScoreCeiling.PERCENT.scale(breakdown.timing()))
                .content((int) ScoreCeiling.PERCENT.scale(breakdown.contentQuality()))
                .hashtags(features.hashtagBand().getFactor())
                .mentions(mentionFactor(features.mentionCount()))
                .build();
    }

    static int mentionFactor(int mentionCount) {
        if (mentionCount <= 0) {
            return 60;
        }
        if (mentionCount <= 2) {
            return 80;
        }
        if (mentionCount <= 4) {
            return 60;
        }
        return 35;
    }
}
