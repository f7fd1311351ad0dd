package me.golemcore.virality.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.virality.domain.model.TrendingData;
import me.golemcore.virality.domain.model.TrendingTopic;
import me.golemcore.virality.domain.service.TrendingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Trending topics for hashtag suggestions.
 */
@RestController
@RequestMapping("/api/trending")
@RequiredArgsConstructor
public class TrendingController {

    private final TrendingService trendingService;

    @GetMapping
    public Mono<ResponseEntity<TrendingData>> getTrending(@RequestParam(required = false) String region) {
        return Mono.fromCallable(() -> ResponseEntity.ok(trendingService.getTrendingTopics(region)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Topics related to a keyword.
     */
    @GetMapping("/relevant")
    public Mono<ResponseEntity<List<TrendingTopic>>> getRelevant(@RequestParam String keyword,
            @RequestParam(required = false) String region) {
        return Mono.fromCallable(() -> ResponseEntity.ok(trendingService.getRelevantTopics(keyword, region)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Hashtags ordered by volume, highest first.
     */
    @GetMapping("/hashtags")
    public Mono<ResponseEntity<List<String>>> getTopHashtags(
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String region) {
        return Mono.fromCallable(() -> ResponseEntity.ok(trendingService.getTopHashtags(limit, region)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
