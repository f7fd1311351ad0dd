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

import me.golemcore.virality.cache.CacheKeys;
import me.golemcore.virality.cache.CachePurpose;
import me.golemcore.virality.cache.ResilientCache;
import me.golemcore.virality.domain.exception.LlmCompletionException;
import me.golemcore.virality.domain.exception.MalformedResponseException;
import me.golemcore.virality.domain.model.ContentInsight;
import me.golemcore.virality.domain.model.HashtagSuggestions;
import me.golemcore.virality.domain.model.ImprovedVersion;
import me.golemcore.virality.domain.model.TweetImprovements;
import me.golemcore.virality.infrastructure.config.ViralityProperties;
import me.golemcore.virality.port.outbound.CompletionPort;
import me.golemcore.virality.port.outbound.CompletionPort.CompletionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Qualitative analysis, rewrites and hashtag ideas from the completion API.
 *
 * <p>
 * Every operation is optional enrichment: when the API is not configured,
 * fails, or answers with a document that does not match the expected shape,
 * the result is empty and the caller carries on without it. Only successful
 * results are cached.
 */
@Service
@Slf4j
public class ContentInsightService {

    private static final long RESULT_GRACE_MS = 1000;

    private static final String JSON_ONLY = "IMPORTANT: Return ONLY valid JSON without any markdown formatting, "
            + "code blocks, or additional text.";

    private static final String INSIGHT_SYSTEM_PROMPT = """
            You are an expert social media analyst specializing in Twitter virality. \
            Analyze the given tweet for its potential to go viral.

            %s

            Return your analysis in this exact JSON format:
            {
              "viralityScore": number (0-100),
              "contentAnalysis": {
                "emotionalImpact": number (0-100),
                "engagementPotential": number (0-100),
                "clarityScore": number (0-100),
                "trendingRelevance": number (0-100)
              },
              "detailedInsights": [string array of 3-5 specific insights],
              "improvementAreas": [string array of 2-4 areas for improvement]
            }

            Consider emotional resonance, engagement hooks (questions, calls-to-action), \
            clarity and readability, trending relevance, length and structure, \
            hashtag usage, mention strategy and timing.

            Be specific and actionable in your insights.""".formatted(JSON_ONLY);

    private static final String IMPROVEMENT_SYSTEM_PROMPT = """
            You are a Twitter optimization expert. Given a tweet and its analysis, \
            generate improved versions that maximize viral potential.

            %s

            Return your response in this exact JSON format:
            {
              "improvedVersions": [
                {
                  "text": "improved tweet text",
                  "changes": ["list of specific changes made"],
                  "expectedScoreIncrease": number (0-50),
                  "reasoning": "explanation of why this version is better"
                }
              ],
              "alternativeApproaches": ["2-3 different conceptual approaches to the same topic"]
            }

            Guidelines:
            - Keep the core message intact
            - Optimize for engagement, clarity, and emotional impact
            - Maintain authenticity
            - Ensure optimal length (100-280 characters)
            - Add relevant hashtags (1-3 max)
            - Include engagement hooks when appropriate""".formatted(JSON_ONLY);

    private static final String HASHTAG_SYSTEM_PROMPT = """
            You are a hashtag optimization expert. Suggest relevant hashtags for the given tweet.

            %s

            Return your response in this exact JSON format:
            {
              "trending": ["2-3 currently trending hashtags relevant to the content"],
              "niche": ["2-3 niche-specific hashtags for targeted reach"],
              "engagement": ["1-2 hashtags designed to encourage engagement"]
            }

            Only suggest hashtags that are genuinely relevant. \
            Avoid overused or spammy hashtags.""".formatted(JSON_ONLY);

    private final CompletionPort completion;
    private final ResilientCache cache;
    private final ObjectMapper objectMapper;
    private final long timeoutMs;

    public ContentInsightService(CompletionPort completion, ResilientCache cache, ObjectMapper objectMapper,
            ViralityProperties properties) {
        this.completion = completion;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.timeoutMs = properties.getLlm().getTimeoutMs();
    }

    public boolean isAvailable() {
        return completion.isAvailable();
    }

    public Optional<ContentInsight> analyzeContent(String text) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getOrCompute(CachePurpose.INSIGHT, CacheKeys.tweetInsight(text),
                ContentInsight.class,
                () -> request("content analysis",
                        new CompletionRequest(INSIGHT_SYSTEM_PROMPT,
                                "Analyze this tweet for viral potential:\n\n\"" + text + "\"", 0.3, 1000),
                        this::parseInsight)));
    }

    /**
     * Rewrites proposed for the post, optionally informed by a prior
     * {@link #analyzeContent(String)} result.
     */
    public Optional<TweetImprovements> improve(String text, ContentInsight insight) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        String fragment = insight != null ? CacheKeys.hash(String.join("|", insight.getDetailedInsights())) : null;
        StringBuilder userPrompt = new StringBuilder("Original tweet: \"").append(text).append("\"\n\n");
        if (insight != null) {
            userPrompt.append("Analysis insights: ").append(toJson(insight.getDetailedInsights())).append("\n\n");
        }
        userPrompt.append("Generate 3 improved versions with different optimization strategies.");

        return Optional.ofNullable(cache.getOrCompute(CachePurpose.SUGGESTIONS,
                CacheKeys.tweetSuggestions(text, fragment), TweetImprovements.class,
                () -> request("improvements",
                        new CompletionRequest(IMPROVEMENT_SYSTEM_PROMPT, userPrompt.toString(), 0.7, 1500),
                        this::parseImprovements)));
    }

    public Optional<HashtagSuggestions> suggestHashtags(String text) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getOrCompute(CachePurpose.HASHTAGS, CacheKeys.hashtagSuggestions(text),
                HashtagSuggestions.class,
                () -> request("hashtags",
                        new CompletionRequest(HASHTAG_SYSTEM_PROMPT,
                                "Suggest hashtags for this tweet: \"" + text + "\"", 0.5, 500),
                        this::parseHashtags)));
    }

    private <T> T request(String operation, CompletionRequest request, Function<JsonNode, T> parser) {
        CompletableFuture<String> future = completion.complete(request);
        try {
            String content = future.get(timeoutMs + RESULT_GRACE_MS, TimeUnit.MILLISECONDS);
            T result = parser.apply(readJson(content));
            log.debug("[Insight] {} completed", operation);
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Insight] {} unavailable: {}", operation, cause.getMessage());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Insight] {} timed out after {}ms", operation, timeoutMs + RESULT_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("[Insight] {} interrupted", operation);
        } catch (MalformedResponseException | LlmCompletionException e) {
            log.warn("[Insight] {} rejected: {}", operation, e.getMessage());
        }
        return null;
    }

    JsonNode readJson(String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedResponseException("Empty completion");
        }
        String cleaned = stripCodeFences(content.trim());
        try {
            JsonNode node = objectMapper.readTree(cleaned);
            if (node == null || !node.isObject()) {
                throw new MalformedResponseException("Completion is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Completion is not valid JSON", e);
        }
    }

    static String stripCodeFences(String content) {
        String cleaned = content;
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring("```json".length());
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        } else {
            return cleaned;
        }
        cleaned = cleaned.strip();
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3).strip();
        }
        return cleaned;
    }

    private ContentInsight parseInsight(JsonNode root) {
        JsonNode analysis = root.get("contentAnalysis");
        if (analysis == null || !analysis.isObject()) {
            throw new MalformedResponseException("Missing contentAnalysis");
        }
        return ContentInsight.builder()
                .viralityScore(percent(root, "viralityScore"))
                .emotionalImpact(percent(analysis, "emotionalImpact"))
                .engagementPotential(percent(analysis, "engagementPotential"))
                .clarityScore(percent(analysis, "clarityScore"))
                .trendingRelevance(percent(analysis, "trendingRelevance"))
                .detailedInsights(strings(root, "detailedInsights"))
                .improvementAreas(strings(root, "improvementAreas"))
                .build();
    }

    private TweetImprovements parseImprovements(JsonNode root) {
        JsonNode versions = root.get("improvedVersions");
        if (versions == null || !versions.isArray()) {
            throw new MalformedResponseException("Missing improvedVersions");
        }
        List<ImprovedVersion> improved = new ArrayList<>();
        for (JsonNode version : versions) {
            if (!version.isObject()) {
                throw new MalformedResponseException("improvedVersions entry is not an object");
            }
            improved.add(new ImprovedVersion(
                    text(version, "text"),
                    strings(version, "changes"),
                    number(version, "expectedScoreIncrease"),
                    version.hasNonNull("reasoning") ? text(version, "reasoning") : "")); // reasoning is optional
        }
        return new TweetImprovements(improved, strings(root, "alternativeApproaches"));
    }

    private HashtagSuggestions parseHashtags(JsonNode root) {
        return new HashtagSuggestions(strings(root, "trending"), strings(root, "niche"),
                strings(root, "engagement"));
    }

    private static int percent(JsonNode node, String field) {
        return Math.max(0, Math.min(100, number(node, field)));
    }

    private static int number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new MalformedResponseException("Missing or non-numeric field: " + field);
        }
        return (int) Math.round(value.asDouble());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedResponseException("Missing or non-string field: " + field);
        }
        return value.asText();
    }

    private static List<String> strings(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            throw new MalformedResponseException("Missing or non-array field: " + field);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw new MalformedResponseException("Non-string entry in " + field);
            }
            values.add(item.asText());
        }
        return values;
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            return String.join("; ", values);
        }
    }
}
