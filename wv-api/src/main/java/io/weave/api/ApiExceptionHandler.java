package io.weave.api;

import io.weave.core.CycleException;
import io.weave.governance.InvalidApproverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Keeps "your dependency graph is wrong" apart from "your approver list is wrong". */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ErrorBody(String error, String message) {}

    @ExceptionHandler(CycleException.class)
    public ResponseEntity<ErrorBody> cycle(CycleException ex) {
        log.warn("Rejected cyclic dependency: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorBody("cycle", ex.getMessage()));
    }

    @ExceptionHandler(InvalidApproverException.class)
    public ResponseEntity<ErrorBody> invalidApprover(InvalidApproverException ex) {
        log.warn("Rejected approver: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorBody("invalid_approver", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorBody> conflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorBody("conflict", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> badRequest(IllegalArgumentException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorBody("bad_request", ex.getMessage()));
    }
}
