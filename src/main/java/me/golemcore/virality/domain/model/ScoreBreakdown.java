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
 * The five unscaled sub-scores of a post, each in {@code [0, 1]}.
 *
 * <p>
 * The composite score is the weighted sum of the factors. Weights are fixed,
 * non-negative and sum to 1, so the composite is also in {@code [0, 1]}. Use
 * {@link ScoreCeiling} to present it on a caller's scale.
 */
@Builder
public record ScoreBreakdown(
        double contentQuality,
        double socialSignals,
        double timing,
        double userReputation,
        double safetyScore) {

    public static final double CONTENT_QUALITY_WEIGHT = 0.30;
    public static final double SOCIAL_SIGNALS_WEIGHT = 0.25;
    public static final double TIMING_WEIGHT = 0.15;
    public static final double USER_REPUTATION_WEIGHT = 0.10;
    public static final double SAFETY_WEIGHT = 0.20;

    public ScoreBreakdown {
        requireUnit("contentQuality", contentQuality);
        requireUnit("socialSignals", socialSignals);
        requireUnit("timing", timing);
        requireUnit("userReputation", userReputation);
        requireUnit("safetyScore", safetyScore);
    }

    public double composite() {
        return contentQuality * CONTENT_QUALITY_WEIGHT
                + socialSignals * SOCIAL_SIGNALS_WEIGHT
                + timing * TIMING_WEIGHT
                + userReputation * USER_REPUTATION_WEIGHT
                + safetyScore * SAFETY_WEIGHT;
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
