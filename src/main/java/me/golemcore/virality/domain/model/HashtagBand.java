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
 * Classification of a post's hashtag count.
 */
public enum HashtagBand {

    NONE(30),
    OPTIMAL(85),
    HEAVY(65),
    EXCESSIVE(40);

    private final int factor;

    HashtagBand(int factor) {
        this.factor = factor;
    }

    /**
     * Hashtag factor on a 0-100 scale.
     */
    public int getFactor() {
        return factor;
    }

    public static HashtagBand of(int hashtagCount) {
        if (hashtagCount <= 0) {
            return NONE;
        }
        if (hashtagCount <= 3) {
            return OPTIMAL;
        }
        if (hashtagCount <= 5) {
            return HEAVY;
        }
        return EXCESSIVE;
    }
}
