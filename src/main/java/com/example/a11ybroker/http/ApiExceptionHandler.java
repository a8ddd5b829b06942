package com.example.a11ybroker.http;

import com.example.a11ybroker.service.BrokerException;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(BrokerException.class)
    public ResponseEntity<Map<String, Object>> domainError(BrokerException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case INVALID_EVENT, INVALID_REQUEST -> status = HttpStatus.BAD_REQUEST;
            case UNKNOWN_APPLICATION, SUBSCRIPTION_NOT_FOUND, EVENT_NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            case DUPLICATE_SUBSCRIPTION -> status = HttpStatus.CONFLICT;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is4xxClientError()) {
            log.warn("Rejected request: {} {}", ex.getCode(), ex.getMessage());
        } else {
            log.error("Broker failure: {}", ex.getMessage(), ex);
        }

        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", ex.getCode().name(),
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        log.warn("Rejected request body: {}", message);
        return ResponseEntity.badRequest()
                .body(Map.of("code", BrokerException.Code.INVALID_REQUEST.name(), "message", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("code", BrokerException.Code.INVALID_REQUEST.name(),
                        "message", "request body is missing or malformed"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "bad request";
        return ResponseEntity.badRequest()
                .body(Map.of("code", BrokerException.Code.INVALID_REQUEST.name(), "message", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", message));
    }
}
