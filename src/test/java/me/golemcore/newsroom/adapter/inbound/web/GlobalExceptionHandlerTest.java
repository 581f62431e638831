package me.golemcore.newsroom.adapter.inbound.web;

import me.golemcore.newsroom.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.newsroom.domain.exception.RunAbortedException;
import me.golemcore.newsroom.domain.model.Checkpoint;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown run: run-9");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Unknown run: run-9", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleRunAbortedException() {
        Instant now = Instant.parse("2026-03-02T09:30:00Z");
        Checkpoint failure = new Checkpoint("run-1", 12, NodeName.PUBLISHER, null,
                RunState.start("run-1", "Publish a linkedin article", now), now, FailureKind.PUBLISH_FAILED);
        RunAbortedException ex = new RunAbortedException(FailureKind.PUBLISH_FAILED, "Publish call failed", null,
                failure);

        StepVerifier.create(handler.handleRunAborted(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("run-1", body.getRunId());
                    assertEquals("PUBLISH_FAILED", body.getFailureKind());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalStateException() {
        IllegalStateException ex = new IllegalStateException("Run is not active: run-1");

        StepVerifier.create(handler.handleIllegalState(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(409, body.getStatus());
                    assertNull(body.getRunId());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NPE in node")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
