package com.techStack.geoAccess.handler;

import com.techStack.geoAccess.dto.response.ErrorResponse;
import com.techStack.geoAccess.exception.service.CustomException;
import com.techStack.geoAccess.exception.validation.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.MethodNotAllowedException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Global Exception Handler
 *
 * Consistent {@link ErrorResponse} bodies for the administrative and user APIs.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    /* =========================
       Domain Exceptions
       ========================= */

    @ExceptionHandler(CustomException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCustomException(CustomException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.getStatus() != null ? ex.getStatus() : HttpStatus.INTERNAL_SERVER_ERROR;
        Map<String, String> errors = ex instanceof ValidationException validation ? validation.getFieldErrors() : null;

        if (status.is5xxServerError()) {
            log.error("{} at {}: {}", ex.getCode(), path(exchange), ex.getMessage(), ex);
        } else {
            log.debug("{} at {}: {}", ex.getCode(), path(exchange), ex.getMessage());
        }

        return respond(status, ex.getCode(), ex.getMessage(), ex.getField(), errors, exchange);
    }

    /* =========================
       Request Binding
       ========================= */

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationExceptions(WebExchangeBindException ex,
                                                                          ServerWebExchange exchange) {
        Map<String, String> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        error -> error.getDefaultMessage() != null ?
                                error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing,
                        LinkedHashMap::new
                ));

        log.debug("Bean validation errors at {}: {}", path(exchange), fieldErrors);

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                "Please correct the following errors and try again", null, fieldErrors, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex,
                                                                    ServerWebExchange exchange) {
        log.debug("Malformed request at {}: {}", path(exchange), ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                ex.getReason() != null ? ex.getReason() : "Malformed request", null, null, exchange);
    }

    @ExceptionHandler(MethodNotAllowedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMethodNotAllowed(MethodNotAllowedException ex,
                                                                      ServerWebExchange exchange) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED",
                "Method " + ex.getHttpMethod() + " is not supported here", null, null, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex,
                                                                    ServerWebExchange exchange) {
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(code.value());
        return respond(status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR,
                status != null ? status.name() : "ERROR",
                ex.getReason() != null ? ex.getReason() : "Request failed", null, null, exchange);
    }

    /* =========================
       Unexpected Exceptions
       ========================= */

    @ExceptionHandler(TimeoutException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleTimeoutException(TimeoutException ex,
                                                                      ServerWebExchange exchange) {
        log.warn("Request timeout at {}: {}", path(exchange), ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "TIMEOUT",
                "The operation timed out. Please try again.", null, null, exchange);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error at {}", path(exchange), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An internal error occurred. Our team has been notified.", null, null, exchange);
    }

    /* =========================
       Helpers
       ========================= */

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status,
                                                        String errorCode,
                                                        String message,
                                                        String field,
                                                        Map<String, String> errors,
                                                        ServerWebExchange exchange) {
        Instant now = clock.instant();
        ErrorResponse body = ErrorResponse.builder()
                .success(false)
                .status(status.value())
                .errorCode(errorCode)
                .message(message)
                .field(field)
                .errors(errors)
                .timestamp(now)
                .path(path(exchange))
                .build();

        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private static String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }
}
