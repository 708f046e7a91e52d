package me.golemcore.reposcout.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reposcout.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.reposcout.domain.exception.SessionBusyException;
import me.golemcore.reposcout.domain.exception.StoreUnavailableException;
import me.golemcore.reposcout.domain.exception.UnknownObjectiveException;
import me.golemcore.reposcout.domain.exception.UnresolvableConflictException;
import me.golemcore.reposcout.domain.model.DetectedConflict;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Maps pipeline failures to {@link ApiErrorResponse} bodies.
 */
@ControllerAdvice(basePackages = "me.golemcore.reposcout.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownObjectiveException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUnknownObjective(UnknownObjectiveException ex) {
        log.warn("[API] Unknown objective(s): {}", ex.getUnknownObjectives());
        return respond(HttpStatus.BAD_REQUEST, ex.getKind().name(), ex.getMessage(), ex.getUnknownObjectives());
    }

    @ExceptionHandler(UnresolvableConflictException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUnresolvableConflict(UnresolvableConflictException ex) {
        List<String> pairs = ex.getOffendingPairs().stream()
                .map(DetectedConflict::describe)
                .toList();
        log.warn("[API] Unresolvable conflict: {}", pairs);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getKind().name(), ex.getMessage(), pairs);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.warn("[API] Store unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", ex.getMessage(), List.of());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, status.name(), ex.getReason(), List.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), List.of());
    }

    @ExceptionHandler(SessionBusyException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSessionBusy(SessionBusyException ex) {
        log.warn("[API] Session busy: {}", ex.getSessionId());
        return respond(HttpStatus.CONFLICT, "SESSION_BUSY", ex.getMessage(), List.of(ex.getSessionId()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "Internal server error", List.of());
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String kind, String message,
            List<String> details) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .kind(kind)
                .message(message)
                .details(details)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
