package me.golemcore.proxy.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.proxy.domain.exception.ScheduleNotFoundException;
import me.golemcore.proxy.domain.exception.ScheduleStoreException;
import me.golemcore.proxy.domain.exception.SessionStartException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps domain exceptions of the schedule API to HTTP statuses with an
 * {@link ApiErrorResponse} body. Validation problems are 400, a missing or
 * foreign schedule 404, conflicts and invalid transitions 409, a failed session
 * start 502 and an unavailable store 503.
 */
@ControllerAdvice(basePackages = "me.golemcore.proxy.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInput(ServerWebInputException ex) {
        log.warn("[API] Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Invalid request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ScheduleNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(ScheduleNotFoundException ex) {
        log.debug("[API] Not found: {}", ex.getScheduleId());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(SessionStartException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSessionStart(SessionStartException ex) {
        log.warn("[API] Session start failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(ScheduleStoreException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStore(ScheduleStoreException ex) {
        log.error("[API] Schedule store unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Schedule store unavailable");
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
