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

package me.golemcore.virality.adapter.outbound.scorer;

import me.golemcore.virality.domain.exception.MalformedResponseException;
import me.golemcore.virality.domain.model.AlgorithmScore;
import me.golemcore.virality.domain.model.AlgorithmSuggestion;
import me.golemcore.virality.domain.model.AnalysisReport;
import me.golemcore.virality.domain.model.ScoreBreakdown;
import me.golemcore.virality.domain.model.ScoringStrategy;
import me.golemcore.virality.domain.model.SuggestionPriority;
import me.golemcore.virality.domain.model.SuggestionType;
import me.golemcore.virality.domain.model.TweetFeatures;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Strict parser for the heavy scorer's stdout document.
 *
 * <p>
 * Every field the pipeline relies on must be present with the right JSON
 * type; breakdown factors and derived scores must lie in {@code [0, 1]}. The
 * composite score is recomputed from the breakdown, so the process's own
 * {@code virality_score} is only checked for type.
 */
@Component
@RequiredArgsConstructor
public class HeavyScorerResponseParser {

    private final ObjectMapper objectMapper;

    public AnalysisReport parse(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            throw new MalformedResponseException("Heavy scorer produced no output");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stdout.trim());
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Heavy scorer output is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("Heavy scorer output is not a JSON object");
        }

        JsonNode scoreNode = requireObject(root, "score", "");
        ScoreBreakdown breakdown = parseBreakdown(requireObject(scoreNode, "breakdown", "score."));
        TweetFeatures features = parseFeatures(requireObject(scoreNode, "features", "score."));
        requireNumber(scoreNode, "virality_score", "score.");
        requireUnit(scoreNode, "light_ranker_score", "score.");

        AlgorithmScore score = AlgorithmScore.builder()
                .breakdown(breakdown)
                .compositeScore(breakdown.composite())
                .toxicityScore(requireUnit(scoreNode, "toxicity_score", "score."))
                .engagementScore(requireUnit(scoreNode, "engagement_score", "score."))
                .features(features)
                .strategyUsed(ScoringStrategy.PRIMARY)
                .build();

        return AnalysisReport.builder()
                .score(score)
                .suggestions(parseSuggestions(root))
                .algorithmVersion(requireText(root, "algorithm_version", ""))
                .processingTimeMs(requireLong(root, "processing_time", ""))
                .build();
    }

    private ScoreBreakdown parseBreakdown(JsonNode node) {
        String path = "score.breakdown.";
        return ScoreBreakdown.builder()
                .contentQuality(requireUnit(node, "content_quality", path))
                .socialSignals(requireUnit(node, "social_signals", path))
                .timing(requireUnit(node, "timing", path))
                .userReputation(requireUnit(node, "user_reputation", path))
                .safetyScore(requireUnit(node, "safety_score", path))
                .build();
    }

    private TweetFeatures parseFeatures(JsonNode node) {
        String path = "score.features.";
        return TweetFeatures.builder()
                .text(requireText(node, "text", path))
                .hasUrl(requireBoolean(node, "has_url", path))
                .hasMedia(requireBoolean(node, "has_media", path))
                .isRetweet(requireBoolean(node, "is_retweet", path))
                .isReply(requireBoolean(node, "is_reply", path))
                .length(requireCount(node, "length", path))
                .hashtagCount(requireCount(node, "hashtag_count", path))
                .mentionCount(requireCount(node, "mention_count", path))
                .questionMarkCount(requireCount(node, "question_mark_count", path))
                .exclamationCount(requireCount(node, "exclamation_count", path))
                .timestamp(requireLong(node, "timestamp", path))
                .authorId(optionalText(node, "author_id", path))
                .postId(optionalText(node, "tweet_id", path))
                .build();
    }

    private List<AlgorithmSuggestion> parseSuggestions(JsonNode root) {
        JsonNode array = root.get("suggestions");
        if (array == null || !array.isArray()) {
            throw new MalformedResponseException("Missing or non-array field: suggestions");
        }
        List<AlgorithmSuggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode item = array.get(i);
            String path = "suggestions[" + i + "].";
            if (!item.isObject()) {
                throw new MalformedResponseException("Not an object: suggestions[" + i + "]");
            }
            String type = requireText(item, "type", path);
            String priority = requireText(item, "priority", path);
            suggestions.add(AlgorithmSuggestion.builder()
                    .type(SuggestionType.fromWireName(type)
                            .orElseThrow(() -> new MalformedResponseException(
                                    "Unknown suggestion type at " + path + "type: " + type)))
                    .priority(SuggestionPriority.fromWireName(priority)
                            .orElseThrow(() -> new MalformedResponseException(
                                    "Unknown suggestion priority at " + path + "priority: " + priority)))
                    .text(requireText(item, "suggestion", path))
                    .expectedImprovement(requireInt(item, "expected_improvement", path))
                    .build());
        }
        return suggestions;
    }

    private static JsonNode requireObject(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Missing or non-object field: " + path + field);
        }
        return node;
    }

    private static JsonNode requireNumber(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isNumber()) {
            throw new MalformedResponseException("Missing or non-numeric field: " + path + field);
        }
        return node;
    }

    private static double requireUnit(JsonNode parent, String field, String path) {
        double value = requireNumber(parent, field, path).asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MalformedResponseException("Field out of [0, 1]: " + path + field + "=" + value);
        }
        return value;
    }

    private static int requireCount(JsonNode parent, String field, String path) {
        int value = requireInt(parent, field, path);
        if (value < 0) {
            throw new MalformedResponseException("Not a non-negative integer: " + path + field);
        }
        return value;
    }

    private static int requireInt(JsonNode parent, String field, String path) {
        JsonNode node = requireNumber(parent, field, path);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new MalformedResponseException("Not an integer: " + path + field);
        }
        return node.intValue();
    }

    private static long requireLong(JsonNode parent, String field, String path) {
        JsonNode node = requireNumber(parent, field, path);
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new MalformedResponseException("Not an integer: " + path + field);
        }
        return node.longValue();
    }

    private static boolean requireBoolean(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isBoolean()) {
            throw new MalformedResponseException("Missing or non-boolean field: " + path + field);
        }
        return node.asBoolean();
    }

    private static String requireText(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isTextual()) {
            throw new MalformedResponseException("Missing or non-string field: " + path + field);
        }
        return node.asText();
    }

    private static String optionalText(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new MalformedResponseException("Non-scalar field: " + path + field);
        }
        return node.asText();
    }
}
