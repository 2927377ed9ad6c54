package com.finopsguard.api;

import com.finopsguard.parser.ParseException;
import com.finopsguard.policy.PolicyNotFoundException;
import com.finopsguard.policy.expression.PolicyExpressionException;
import com.finopsguard.simulation.AnalysisTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses with a small JSON body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ParseException.class)
    public ResponseEntity<Map<String, Object>> handleParseException(ParseException ex) {
        log.info("Rejected unparseable IaC: {}", ex.getMessage());
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, ex.getMessage());
        if (ex.getResourceName() != null) {
            body.put("resource", ex.getResourceName());
        }
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({IllegalArgumentException.class, PolicyExpressionException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        log.info("Bad request: {}", ex.getMessage());
        return new ResponseEntity<>(body(HttpStatus.BAD_REQUEST, ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return new ResponseEntity<>(body(HttpStatus.BAD_REQUEST, message), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(PolicyNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(PolicyNotFoundException ex) {
        return new ResponseEntity<>(body(HttpStatus.NOT_FOUND, ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    /**
     * Only raised when no resource could be priced; partial results are
     * returned as a normal check response flagged {@code analysis_timeout}.
     */
    @ExceptionHandler(AnalysisTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(AnalysisTimeoutException ex) {
        log.warn("Cost analysis timed out: {}", ex.getMessage());
        return new ResponseEntity<>(body(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage()), HttpStatus.GATEWAY_TIMEOUT);
    }

    private static Map<String, Object> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return body;
    }
}
