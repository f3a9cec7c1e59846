package com.collab.sync.jetstream.admin;

import com.collab.sync.core.event.FieldViolation;
import com.collab.sync.core.event.SchemaValidationException;
import com.collab.sync.core.event.UnknownEventTypeException;
import com.collab.sync.core.log.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.NoSuchElementException;

/**
 * Maps admin API failures to {@link ApiError} bodies. Stack traces stay in the server log.
 *
 * <pre>
 * UnknownEventTypeException, SchemaValidationException,
 * IllegalArgumentException, bind / input errors         → 400
 * NoSuchElementException                                 → 404
 * IllegalStateException (missing group)                  → 409
 * TransportException                                     → 503
 * anything else                                          → 500
 * </pre>
 */
@RestControllerAdvice(assignableTypes = EventLogAdminController.class)
class AdminExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AdminExceptionHandler.class);

    @ExceptionHandler(UnknownEventTypeException.class)
    public ResponseEntity<ApiError> unknownType(UnknownEventTypeException e) {
        return ResponseEntity.badRequest().body(new ApiError("unknown_event_type", e.getMessage()));
    }

    @ExceptionHandler(SchemaValidationException.class)
    public ResponseEntity<ApiError> schema(SchemaValidationException e) {
        return ResponseEntity.badRequest().body(new ApiError(
                "schema_validation",
                "Event validation failed for " + e.getEventType(),
                e.getViolations().stream().map(FieldViolation::toString).toList()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> bind(WebExchangeBindException e) {
        return ResponseEntity.badRequest().body(new ApiError(
                "bad_request",
                "Invalid request body",
                e.getFieldErrors().stream().map(f -> f.getField() + ": " + f.getDefaultMessage()).toList()));
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ApiError> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiError> notFound(NoSuchElementException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not_found", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError("conflict", e.getMessage()));
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<ApiError> unavailable(TransportException e) {
        log.warn("Admin endpoint transport failure: {}", e.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError("event_log_unavailable", "Event log unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        log.error("Admin endpoint failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("internal_error", "Request failed"));
    }
}
