package me.golemcore.virality.adapter.inbound.web;

import me.golemcore.virality.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.virality.domain.exception.InvalidInputException;
import me.golemcore.virality.domain.exception.LocalScoringException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebInputException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapInvalidInputToBadRequest() {
        StepVerifier.create(handler.handleInvalidInput(new InvalidInputException("Tweet text is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("Tweet text is required", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapUnreadableBodyToBadRequest() {
        StepVerifier.create(handler.handleUnreadableBody(new ServerWebInputException("Failed to read HTTP message")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Malformed request body", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapLocalScoringFailureToServerError() {
        LocalScoringException error = new LocalScoringException("Local scoring failed",
                new IllegalStateException("boom"));

        StepVerifier.create(handler.handleLocalScoring(error))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Failed to analyze tweet", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideUnexpectedErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret internals")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals(500, response.getBody().getStatus());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
