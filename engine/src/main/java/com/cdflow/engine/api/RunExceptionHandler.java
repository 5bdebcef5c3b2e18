package com.cdflow.engine.api;

import com.cdflow.engine.serializer.SerializationException;
import com.cdflow.engine.service.ValidationException;
import com.cdflow.engine.store.LockConflictException;
import com.cdflow.engine.store.RunNotFoundException;
import com.cdflow.engine.store.RunStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps engine exceptions to HTTP statuses.
 *
 *   RunNotFoundException   → 404
 *   ValidationException    → 400
 *   LockConflictException  → 409 (retryable, not logged as an error)
 *   SerializationException → 500
 *   RunStoreException      → 503
 */
@RestControllerAdvice
public class RunExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RunExceptionHandler.class);

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(RunNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> invalid(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(LockConflictException.class)
    public ResponseEntity<Map<String, String>> locked(LockConflictException e) {
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(SerializationException.class)
    public ResponseEntity<Map<String, String>> serialization(SerializationException e) {
        log.error("Run serialization failure: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(RunStoreException.class)
    public ResponseEntity<Map<String, String>> storage(RunStoreException e) {
        log.error("Run storage failure: {}", e.getMessage(), e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", status.name(), "message", message == null ? "" : message));
    }
}
