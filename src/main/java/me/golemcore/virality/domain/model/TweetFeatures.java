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
 * Structural features of a single post, extracted once per analysis request.
 *
 * <p>
 * {@code authorId} and {@code postId} are optional and may be {@code null}.
 *
 * @param timestamp
 *            extraction time, epoch milliseconds
 */
@Builder
public record TweetFeatures(
        String text,
        boolean hasUrl,
        boolean hasMedia,
        boolean isRetweet,
        boolean isReply,
        int length,
        int hashtagCount,
        int mentionCount,
        int questionMarkCount,
        int exclamationCount,
        long timestamp,
        String authorId,
        String postId) {

    public HashtagBand hashtagBand() {
        return HashtagBand.of(hashtagCount);
    }
}
