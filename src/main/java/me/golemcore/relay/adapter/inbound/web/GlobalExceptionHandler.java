package me.golemcore.relay.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.LaneTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps control API failures to {@link ApiErrorResponse} bodies.
 *
 * <p>
 * Validation problems and unknown jobs are 400, a run-now on a job that is
 * already running is 409, a lane that did not get to the request in time is
 * 504, and a channel that refused a send is 502.
 */
@ControllerAdvice(basePackages = "me.golemcore.relay.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(LaneTimeoutException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleLaneTimeout(LaneTimeoutException ex) {
        log.warn("[API] Lane timeout: {}", ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler(DeliveryException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleDelivery(DeliveryException ex) {
        log.warn("[API] Delivery via {} failed: {}", ex.getChannelType(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
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
