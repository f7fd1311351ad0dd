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

import me.golemcore.virality.domain.exception.ExternalProcessException;
import me.golemcore.virality.domain.exception.InvalidInputException;
import me.golemcore.virality.domain.exception.LocalScoringException;
import me.golemcore.virality.domain.model.AlgorithmScore;
import me.golemcore.virality.domain.model.AnalysisReport;
import me.golemcore.virality.domain.model.ScoreBreakdown;
import me.golemcore.virality.domain.model.ScoringStrategy;
import me.golemcore.virality.domain.model.TweetFeatures;
import me.golemcore.virality.port.outbound.HeavyScorerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Two-tier analysis: the external heavy scorer first, local heuristics on any
 * primary failure.
 *
 * <p>
 * Primary failures (spawn error, timeout, non-zero exit, malformed output) are
 * logged and never surfaced. Only a failure of the local path reaches the
 * caller, as {@link LocalScoringException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FallbackOrchestrator {

    public static final String LOCAL_ALGORITHM_VERSION = "local-heuristic-v1";

    // Slack over the adapter's own bound before the orchestrator stops waiting.
    private static final long RESULT_GRACE_MS = 1000;

    private final HeavyScorerPort heavyScorer;
    private final FeatureExtractor featureExtractor;
    private final ScoringEngine scoringEngine;
    private final SuggestionGenerator suggestionGenerator;
    private final Clock clock;

    public AnalysisReport analyze(String text) {
        validate(text);
        long startedAt = clock.millis();

        Optional<AnalysisReport> primary = attemptPrimary(text);
        if (primary.isPresent()) {
            return primary.get();
        }
        return attemptFallback(text, startedAt);
    }

    public static void validate(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Tweet text is required");
        }
    }

    private Optional<AnalysisReport> attemptPrimary(String text) {
        CompletableFuture<AnalysisReport> future;
        try {
            future = heavyScorer.score(text);
        } catch (RuntimeException e) {
            log.warn("[Fallback] Heavy scorer rejected request: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            AnalysisReport report = future.get(heavyScorer.getTimeoutMs() + RESULT_GRACE_MS,
                    TimeUnit.MILLISECONDS);
            if (report == null || report.getScore() == null) {
                log.warn("[Fallback] Heavy scorer returned no score, using local heuristics");
                return Optional.empty();
            }
            log.debug("[Fallback] Primary path succeeded ({} ms)", report.getProcessingTimeMs());
            return Optional.of(report);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Fallback] Heavy scorer did not answer within {}ms, using local heuristics",
                    heavyScorer.getTimeoutMs() + RESULT_GRACE_MS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Fallback] Heavy scorer failed ({}): {}, using local heuristics", describe(cause),
                    cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("[Fallback] Interrupted waiting for heavy scorer, using local heuristics");
        }
        return Optional.empty();
    }

    private AnalysisReport attemptFallback(String text, long startedAt) {
        try {
            long now = clock.millis();
            TweetFeatures features = featureExtractor.extract(text, now);
            ScoreBreakdown breakdown = scoringEngine.score(features, now);
            AlgorithmScore score = AlgorithmScore.fromBreakdown(breakdown, features, ScoringStrategy.FALLBACK);
            return AnalysisReport.builder()
                    .score(score)
                    .suggestions(suggestionGenerator.suggest(score))
                    .algorithmVersion(LOCAL_ALGORITHM_VERSION)
                    .processingTimeMs(Math.max(0, clock.millis() - startedAt))
                    .build();
        } catch (RuntimeException e) {
            log.error("[Fallback] Local scoring failed", e);
            throw new LocalScoringException("Local scoring failed: " + e.getMessage(), e);
        }
    }

    private static String describe(Throwable cause) {
        if (cause instanceof ExternalProcessException processException) {
            return processException.getKind().name();
        }
        return cause.getClass().getSimpleName();
    }
}
