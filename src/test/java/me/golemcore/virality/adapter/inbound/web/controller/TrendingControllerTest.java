package me.golemcore.virality.adapter.inbound.web.controller;

import me.golemcore.virality.domain.model.TrendingData;
import me.golemcore.virality.domain.model.TrendingTopic;
import me.golemcore.virality.domain.service.TrendingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TrendingControllerTest {

    private static final TrendingTopic AI = new TrendingTopic("#AI", 125_000, TrendingTopic.Category.TECHNOLOGY,
            TrendingTopic.Sentiment.POSITIVE);

    private TrendingService trendingService;
    private TrendingController controller;

    @BeforeEach
    void setUp() {
        trendingService = mock(TrendingService.class);
        controller = new TrendingController(trendingService);
    }

    @Test
    void shouldReturnTrendingTopicsForRegion() {
        TrendingData data = new TrendingData(List.of(AI), Instant.parse("2024-01-15T10:00:00Z"), "GB");
        when(trendingService.getTrendingTopics("gb")).thenReturn(data);

        StepVerifier.create(controller.getTrending("gb"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(data, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnRelevantTopics() {
        when(trendingService.getRelevantTopics("machine learning", null)).thenReturn(List.of(AI));

        StepVerifier.create(controller.getRelevant("machine learning", null))
                .assertNext(response -> assertEquals(List.of(AI), response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnTopHashtags() {
        when(trendingService.getTopHashtags(2, "US")).thenReturn(List.of("#AI", "#Startup"));

        StepVerifier.create(controller.getTopHashtags(2, "US"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(List.of("#AI", "#Startup"), response.getBody());
                })
                .verifyComplete();
    }
}
