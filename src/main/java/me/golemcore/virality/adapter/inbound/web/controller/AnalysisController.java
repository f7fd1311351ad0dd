package me.golemcore.virality.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.virality.adapter.inbound.web.dto.AnalyzeRequest;
import me.golemcore.virality.domain.model.ImprovementSuggestion;
import me.golemcore.virality.domain.model.TweetAnalysis;
import me.golemcore.virality.domain.service.ImprovementService;
import me.golemcore.virality.domain.service.TweetAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Post analysis and rule-based improvement endpoints.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

    private final TweetAnalysisService analysisService;
    private final ImprovementService improvementService;

    @PostMapping("/analyze")
    public Mono<ResponseEntity<TweetAnalysis>> analyze(@RequestBody AnalyzeRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(analysisService.analyze(request.text())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/suggest-improvements")
    public Mono<ResponseEntity<ImprovementSuggestion>> suggestImprovements(@RequestBody AnalyzeRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(improvementService.suggest(request.text())))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
