package dao.tron.rdist.controller;

import dao.tron.rdist.exception.DistributorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps error classes to HTTP status: input 400, policy 409, transient 503, integrity 500.
 */
@Slf4j
@RestControllerAdvice
public class DistributorExceptionHandler {

    @ExceptionHandler(DistributorException.class)
    public ResponseEntity<Map<String, Object>> handle(DistributorException e) {
        HttpStatus status = switch (e.getErrorClass()) {
            case INPUT -> HttpStatus.BAD_REQUEST;
            case POLICY -> HttpStatus.CONFLICT;
            case TRANSIENT -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTEGRITY -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Request failed: [{}] {}", e.getErrorCode(), e.getMessage());
        } else {
            log.debug("Request rejected: [{}] {}", e.getErrorCode(), e.getMessage());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("code", e.getErrorCode().name());
        body.put("errorCode", e.getErrorCode().getCode());
        body.put("errorClass", e.getErrorClass());
        body.put("error", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
