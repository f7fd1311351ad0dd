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

/**
 * Presentation scales for the normalized composite score.
 *
 * <p>
 * Scores are kept in {@code [0, 1]} internally; this is the only place where
 * they are converted to or from a caller's scale.
 */
public enum ScoreCeiling {

    /** Scale used by the analysis API. */
    PERCENT(100),

    /** Scale used by A/B variant comparison. */
    EXTENDED(500);

    private final int ceiling;

    ScoreCeiling(int ceiling) {
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }

    /**
     * Converts a normalized score to this scale, clamping out-of-range input.
     */
    public long scale(double normalized) {
        return Math.round(clampUnit(normalized) * ceiling);
    }

    /**
     * Converts a value on this scale back to {@code [0, 1]}.
     */
    public double normalize(double scaled) {
        return clampUnit(scaled / ceiling);
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
