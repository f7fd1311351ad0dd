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

import me.golemcore.virality.domain.model.ScoreBreakdown;
import me.golemcore.virality.domain.model.TweetFeatures;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Local heuristic scorer: bounded additive rules per factor, each clamped to
 * {@code [0, 1]}.
 *
 * <p>
 * Deterministic for fixed features and {@code nowMs}. The injected
 * {@link Clock} only supplies the zone used to read the hour of day.
 *
 * <ul>
 * <li><b>contentQuality</b> - base 0.5; rewards 50-200 chars, a question,
 * 1-2 exclamations, 1-3 hashtags, 1-2 mentions, links and media; penalizes
 * retweets and excessive hashtags, mentions or exclamations</li>
 * <li><b>socialSignals</b> - base 0.3; rewards a question, call-to-action and
 * emotional vocabulary, and 100-200 chars</li>
 * <li><b>timing</b> - 0.9 at peak hours, 0.7 in the daytime window, 0.4
 * otherwise</li>
 * <li><b>userReputation</b> - placeholder, see
 * {@link #USER_REPUTATION_PLACEHOLDER}</li>
 * <li><b>safetyScore</b> - {@code 1 - toxicity}</li>
 * </ul>
 */
@Component
public class ScoringEngine {

    /**
     * Stub reputation used for every author until a user graph is available.
     */
    public static final double USER_REPUTATION_PLACEHOLDER = 0.7;

    static final double CONTENT_BASE = 0.5;
    static final double SOCIAL_BASE = 0.3;
    static final double TIMING_PEAK = 0.9;
    static final double TIMING_DAYTIME = 0.7;
    static final double TIMING_OFF_HOURS = 0.4;
    static final double TOXICITY_PER_TERM = 0.2;

    private static final Set<Integer> PEAK_HOURS = Set.of(9, 10, 12, 13, 17, 18, 19, 20, 21);
    private static final int DAYTIME_START_HOUR = 8;
    private static final int DAYTIME_END_HOUR = 22;

    private static final List<Pattern> CALL_TO_ACTION_TERMS = terms(
            "what", "think", "opinion", "agree", "disagree", "thoughts", "share");
    private static final List<Pattern> EMOTIONAL_TERMS = terms(
            "amazing", "incredible", "shocking", "unbelievable", "wow");
    private static final List<Pattern> TOXIC_TERMS = terms(
            "hate", "stupid", "idiot", "moron", "kill", "die", "damn", "hell",
            "crap", "suck", "terrible", "awful", "disgusting", "pathetic");

    private final ZoneId zone;

    public ScoringEngine(Clock clock) {
        this.zone = clock.getZone();
    }

    public ScoreBreakdown score(TweetFeatures features, long nowMs) {
        return ScoreBreakdown.builder()
                .contentQuality(contentQuality(features))
                .socialSignals(socialSignals(features))
                .timing(timing(nowMs))
                .userReputation(USER_REPUTATION_PLACEHOLDER)
                .safetyScore(1.0 - toxicity(features.text()))
                .build();
    }

    double contentQuality(TweetFeatures features) {
        double score = CONTENT_BASE;

        if (features.length() >= 50 && features.length() <= 200) {
            score += 0.1;
        }
        if (features.questionMarkCount() > 0) {
            score += 0.05;
        }
        if (features.exclamationCount() > 0 && features.exclamationCount() <= 2) {
            score += 0.03;
        }
        if (features.hashtagCount() >= 1 && features.hashtagCount() <= 3) {
            score += 0.08;
        }
        if (features.mentionCount() >= 1 && features.mentionCount() <= 2) {
            score += 0.05;
        }
        if (features.hasUrl()) {
            score += 0.02;
        }
        if (features.hasMedia()) {
            score += 0.05;
        }
        if (features.isRetweet()) {
            score -= 0.1;
        }

        if (features.hashtagCount() > 5) {
            score -= 0.1;
        }
        if (features.mentionCount() > 3) {
            score -= 0.05;
        }
        if (features.exclamationCount() > 3) {
            score -= 0.05;
        }
        return clamp(score);
    }

    double socialSignals(TweetFeatures features) {
        double score = SOCIAL_BASE;
        if (features.questionMarkCount() > 0) {
            score += 0.2;
        }
        score += countPresent(CALL_TO_ACTION_TERMS, features.text()) * 0.05;
        score += countPresent(EMOTIONAL_TERMS, features.text()) * 0.03;
        if (features.length() >= 100 && features.length() <= 200) {
            score += 0.1;
        }
        return clamp(score);
    }

    double timing(long nowMs) {
        int hour = Instant.ofEpochMilli(nowMs).atZone(zone).getHour();
        if (PEAK_HOURS.contains(hour)) {
            return TIMING_PEAK;
        }
        if (hour >= DAYTIME_START_HOUR && hour <= DAYTIME_END_HOUR) {
            return TIMING_DAYTIME;
        }
        return TIMING_OFF_HOURS;
    }

    /**
     * Distinct denylisted terms present in the text, scaled and capped at 1.
     */
    public double toxicity(String text) {
        return Math.min(countPresent(TOXIC_TERMS, text) * TOXICITY_PER_TERM, 1.0);
    }

    private static int countPresent(List<Pattern> terms, String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (Pattern term : terms) {
            if (term.matcher(text).find()) {
                count++;
            }
        }
        return count;
    }

    // Whole words plus common inflections, so "hello" is not "hell".
    private static List<Pattern> terms(String... words) {
        return Arrays.stream(words)
                .map(word -> Pattern.compile("\\b" + Pattern.quote(word.toLowerCase(Locale.ROOT))
                        + "(?:s|d|ed|ing)?\\b", Pattern.CASE_INSENSITIVE))
                .toList();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
