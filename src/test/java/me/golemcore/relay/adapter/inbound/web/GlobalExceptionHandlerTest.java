package me.golemcore.relay.adapter.inbound.web;

import me.golemcore.relay.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.LaneTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Cron job not found: job-9");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Cron job not found: job-9", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        IllegalArgumentException ex = new IllegalArgumentException("Invalid cron expression: 61 * * * *");

        StepVerifier.create(handler.handleIllegalArgument(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Invalid cron expression: 61 * * * *", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        IllegalStateException ex = new IllegalStateException("Cron job already running: job-1");

        StepVerifier.create(handler.handleIllegalState(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals(409, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapLaneTimeoutToGatewayTimeout() {
        LaneTimeoutException ex = new LaneTimeoutException("main", 30_000L);

        StepVerifier.create(handler.handleLaneTimeout(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.GATEWAY_TIMEOUT, response.getStatusCode());
                    assertEquals("Command in lane 'main' timed out after 30000 ms", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapDeliveryFailureToBadGateway() {
        DeliveryException ex = new DeliveryException("discord", "Discord API error: HTTP 403 Missing Access");

        StepVerifier.create(handler.handleDelivery(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
                    assertEquals(502, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        RuntimeException ex = new RuntimeException("disk exploded");

        StepVerifier.create(handler.handleGeneric(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
