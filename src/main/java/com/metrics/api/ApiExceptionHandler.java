package com.metrics.api;

import com.metrics.domain.exception.ExecutionTimeoutException;
import com.metrics.domain.exception.InvalidRequestException;
import com.metrics.domain.exception.MetricsQueryException;
import com.metrics.domain.exception.NotFoundException;
import com.metrics.domain.exception.PivotCellLimitExceededException;
import com.metrics.domain.exception.QueryExecutionException;
import com.metrics.domain.exception.UnsupportedDialectException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine failures to HTTP responses. Messages are passed through
 * verbatim; client faults are 4xx, backend faults 5xx.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {
    
    @ExceptionHandler(MetricsQueryException.class)
    public ResponseEntity<Map<String, Object>> handle(MetricsQueryException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", status.value(), e.getMessage());
        }
        
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        if (e instanceof PivotCellLimitExceededException) {
            body.put("limit", ((PivotCellLimitExceededException) e).getLimit());
        }
        if (e instanceof QueryExecutionException) {
            body.put("phase", ((QueryExecutionException) e).getPhase());
        }
        if (e instanceof ExecutionTimeoutException) {
            body.put("phase", ((ExecutionTimeoutException) e).getPhase());
        }
        
        return ResponseEntity.status(status).body(body);
    }
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", InvalidRequestException.class.getSimpleName());
        body.put("message", e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("invalid request"));
        return ResponseEntity.badRequest().body(body);
    }
    
    static HttpStatus statusFor(MetricsQueryException e) {
        if (e instanceof InvalidRequestException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof UnsupportedDialectException) {
            return HttpStatus.NOT_IMPLEMENTED;
        }
        if (e instanceof PivotCellLimitExceededException) {
            return HttpStatus.PAYLOAD_TOO_LARGE;
        }
        if (e instanceof ExecutionTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
