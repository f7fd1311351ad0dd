package me.golemcore.virality.domain.service;

import me.golemcore.virality.domain.model.AnalysisFactors;
import me.golemcore.virality.domain.model.AnalysisReport;
import me.golemcore.virality.domain.model.ContentInsight;
import me.golemcore.virality.domain.model.ScoreCeiling;
import me.golemcore.virality.domain.model.TweetAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Caller-facing analysis: the cached pipeline report on the 0-100 scale with
 * optional completion-based insight and rewrites.
 */
@Service
@RequiredArgsConstructor
public class TweetAnalysisService {

    private final CachedAnalysisService analysisService;
    private final ContentInsightService insightService;

    public TweetAnalysis analyze(String text) {
        AnalysisReport report = analysisService.analyze(text);

        TweetAnalysis.TweetAnalysisBuilder builder = TweetAnalysis.builder()
                .text(text)
                .score(report.getScore().scaledScore(ScoreCeiling.PERCENT))
                .factors(AnalysisFactors.of(report.getScore().breakdown(), report.getScore().features()))
                .strategyUsed(report.getStrategyUsed())
                .suggestions(report.getSuggestions())
                .algorithmVersion(report.getAlgorithmVersion())
                .processingTimeMs(report.getProcessingTimeMs());

        Optional<ContentInsight> insight = insightService.analyzeContent(text);
        insight.ifPresent(value -> {
            builder.insight(value);
            insightService.improve(text, value)
                    .ifPresent(improvements -> builder.improvedVersions(improvements.improvedVersions()));
        });
        return builder.build();
    }
}
