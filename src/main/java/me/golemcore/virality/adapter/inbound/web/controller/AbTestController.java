package me.golemcore.virality.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.virality.adapter.inbound.web.dto.AbTestRequest;
import me.golemcore.virality.domain.model.AbTestResult;
import me.golemcore.virality.domain.service.AbTestService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/ab-test")
@RequiredArgsConstructor
public class AbTestController {

    private final AbTestService abTestService;

    @PostMapping
    public Mono<ResponseEntity<AbTestResult>> runAbTest(@RequestBody AbTestRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                abTestService.runAbTest(request.originalTweet(), request.numVariants())))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
