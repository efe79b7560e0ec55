package com.jsoonworld.delivery.interfaces.rest;

import com.jsoonworld.delivery.domain.exception.NotificationStateException;
import com.jsoonworld.delivery.domain.exception.NotificationValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleBinding(WebExchangeBindException ex) {
        List<String> details = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .toList();
        return Mono.just(ResponseEntity.badRequest().body(body("Validation failed", details)));
    }

    @ExceptionHandler(NotificationValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInvalidNotification(NotificationValidationException ex) {
        log.warn("Rejected invalid notification: violations={}", ex.getViolations());
        return Mono.just(ResponseEntity.badRequest().body(body("Validation failed", ex.getViolations())));
    }

    @ExceptionHandler(NotificationStateException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleState(NotificationStateException ex) {
        log.warn("Notification state conflict: error={}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(body(ex.getMessage(), null)));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleGeneral(Exception ex) {
        log.error("Unhandled exception", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("Internal server error", null)));
    }

    private Map<String, Object> body(String error, List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
