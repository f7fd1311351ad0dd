package me.golemcore.virality.adapter.inbound.web.controller;

import me.golemcore.virality.adapter.inbound.web.dto.AnalyzeRequest;
import me.golemcore.virality.domain.exception.InvalidInputException;
import me.golemcore.virality.domain.model.ImprovementSuggestion;
import me.golemcore.virality.domain.model.ScoringStrategy;
import me.golemcore.virality.domain.model.TweetAnalysis;
import me.golemcore.virality.domain.service.ImprovementService;
import me.golemcore.virality.domain.service.TweetAnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalysisControllerTest {

    private TweetAnalysisService analysisService;
    private ImprovementService improvementService;
    private AnalysisController controller;

    @BeforeEach
    void setUp() {
        analysisService = mock(TweetAnalysisService.class);
        improvementService = mock(ImprovementService.class);
        controller = new AnalysisController(analysisService, improvementService);
    }

    @Test
    void shouldReturnAnalysis() {
        TweetAnalysis analysis = TweetAnalysis.builder()
                .text("hello")
                .score(64)
                .strategyUsed(ScoringStrategy.PRIMARY)
                .algorithmVersion("twitter-heavy-ranker-v2")
                .build();
        when(analysisService.analyze("hello")).thenReturn(analysis);

        StepVerifier.create(controller.analyze(new AnalyzeRequest("hello")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    TweetAnalysis body = response.getBody();
                    assertNotNull(body);
                    assertEquals(64, body.getScore());
                    assertEquals(ScoringStrategy.PRIMARY, body.getStrategyUsed());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateInvalidInput() {
        when(analysisService.analyze(null)).thenThrow(new InvalidInputException("Tweet text is required"));

        StepVerifier.create(controller.analyze(new AnalyzeRequest(null)))
                .expectErrorMatches(error -> error instanceof InvalidInputException
                        && "Tweet text is required".equals(error.getMessage()))
                .verify();
    }

    @Test
    void shouldReturnImprovements() {
        ImprovementSuggestion suggestion = ImprovementSuggestion.builder()
                .original("hello")
                .improved("Hot take: hello What are your thoughts? #AI #Tech")
                .change("Added engagement question")
                .expectedScoreIncrease(8)
                .build();
        when(improvementService.suggest("hello")).thenReturn(suggestion);

        StepVerifier.create(controller.suggestImprovements(new AnalyzeRequest("hello")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(suggestion, response.getBody());
                })
                .verifyComplete();
    }
}
