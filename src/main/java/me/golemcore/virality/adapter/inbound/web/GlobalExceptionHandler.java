package me.golemcore.virality.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.virality.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.virality.domain.exception.InvalidInputException;
import me.golemcore.virality.domain.exception.LocalScoringException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps pipeline failures to API error bodies: rejected input is a 400, a
 * failed local scoring pass or anything unexpected is a 500.
 */
@ControllerAdvice(basePackages = "me.golemcore.virality.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidInput(InvalidInputException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUnreadableBody(ServerWebInputException ex) {
        log.warn("[API] Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(LocalScoringException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleLocalScoring(LocalScoringException ex) {
        log.error("[API] Scoring failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to analyze tweet");
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
