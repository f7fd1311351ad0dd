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

package me.golemcore.virality.domain.service;

import me.golemcore.virality.domain.model.TweetFeatures;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives structural features from raw post text. Pure; never fails.
 */
@Component
public class FeatureExtractor {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+");
    private static final Pattern MEDIA_PATTERN = Pattern.compile("\\[(?:media|photo|video)]",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HASHTAG_PATTERN = Pattern.compile("#\\w+");
    private static final Pattern MENTION_PATTERN = Pattern.compile("@\\w+");

    public TweetFeatures extract(String text, long nowMs) {
        return extract(text, nowMs, null, null);
    }

    public TweetFeatures extract(String text, long nowMs, String authorId, String postId) {
        String source = text != null ? text : "";
        return TweetFeatures.builder()
                .text(source)
                .hasUrl(URL_PATTERN.matcher(source).find())
                .hasMedia(MEDIA_PATTERN.matcher(source).find())
                .isRetweet(source.startsWith("RT @") || source.contains("via @"))
                .isReply(source.startsWith("@"))
                .length(source.length())
                .hashtagCount(count(HASHTAG_PATTERN, source))
                .mentionCount(count(MENTION_PATTERN, source))
                .questionMarkCount(countChar(source, '?'))
                .exclamationCount(countChar(source, '!'))
                .timestamp(nowMs)
                .authorId(authorId)
                .postId(postId)
                .build();
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static int countChar(String text, char c) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
