package com.lctp.trio.controller;

import com.lctp.trio.exception.ConsistencyException;
import com.lctp.trio.exception.ContestException;
import com.lctp.trio.exception.DrawException;
import com.lctp.trio.exception.DuplicateQuotaException;
import com.lctp.trio.exception.InvalidPlacementException;
import com.lctp.trio.exception.QuotaBlockedException;
import com.lctp.trio.exception.QuotaExhaustedException;
import com.lctp.trio.exception.ResourceNotFoundException;
import com.lctp.trio.exception.TrioValidationException;
import com.lctp.trio.exception.UnknownCategoryTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps contest exceptions to {@code {success:false, error, reason}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({TrioValidationException.class, DrawException.class})
    public ResponseEntity<Map<String, Object>> handleRejected(ContestException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler({UnknownCategoryTypeException.class, InvalidPlacementException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({QuotaExhaustedException.class, QuotaBlockedException.class,
            DuplicateQuotaException.class, ConsistencyException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(ContestException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, RuntimeException e) {
        log.warn("{} -> {}: {}", e.getClass().getSimpleName(), status.value(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", e.getClass().getSimpleName());
        body.put("reason", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
