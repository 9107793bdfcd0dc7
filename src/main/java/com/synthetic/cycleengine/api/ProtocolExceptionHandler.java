package com.synthetic.cycleengine.api;

import com.synthetic.cycleengine.domain.exception.ErrorKind;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ProtocolExceptionHandler {

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<Map<String, Object>> handleProtocol(ProtocolException e) {
        HttpStatus status = statusOf(e.getKind());
        log.debug("[API] rejected {} ({}): {}", e.getCode(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "success", false,
                "code", e.getCode().name(),
                "kind", e.getKind().name(),
                "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "kind", ErrorKind.VALIDATION.name(),
                "message", String.valueOf(e.getMessage())));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case STATE -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case CONSISTENCY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STALENESS -> HttpStatus.SERVICE_UNAVAILABLE;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }
}
