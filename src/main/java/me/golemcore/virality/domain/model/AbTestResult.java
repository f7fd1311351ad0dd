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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of an A/B comparison. The first variant is always the original post.
 *
 * <p>
 * {@code improvementPercent} is the best variant's score gain relative to the
 * original, 0 when the original wins or scores 0.
 */
@Value
@Builder
public class AbTestResult {

    String originalTweet;

    @Singular
    List<TweetVariant> variants;

    TweetVariant bestVariant;
    double improvementPercent;
    boolean generatedByLlm;
    long processingTimeMs;
}
