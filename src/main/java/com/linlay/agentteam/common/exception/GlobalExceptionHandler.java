package com.linlay.agentteam.common.exception;

import com.linlay.agentteam.hierarchy.normalize.HierarchyValidationException;
import com.linlay.agentteam.hierarchy.store.HierarchyNotFoundException;
import com.linlay.agentteam.hierarchy.store.HierarchyStorageException;
import com.linlay.agentteam.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.concurrent.TimeoutException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
        log.error("Unhandled exception", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", "Unexpected error, please retry later.");
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ProblemDetail> handleValidationErrors(WebExchangeBindException ex) {
        String detail = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .findFirst()
                .map(error -> error.getField() + ": " + (error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid"))
                .orElse("Invalid request payload");
        return problem(HttpStatus.BAD_REQUEST, "Validation failed", detail);
    }

    @ExceptionHandler({ServerWebInputException.class, HierarchyValidationException.class})
    public ResponseEntity<ProblemDetail> handleBadInput(RuntimeException ex) {
        String detail = ex instanceof ServerWebInputException input && input.getReason() != null
                ? input.getReason()
                : ex.getMessage();
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", detail);
    }

    @ExceptionHandler({HierarchyNotFoundException.class, SessionNotFoundException.class})
    public ResponseEntity<ProblemDetail> handleNotFound(RuntimeException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not found", ex.getMessage());
    }

    @ExceptionHandler(HierarchyStorageException.class)
    public ResponseEntity<ProblemDetail> handleStorage(HierarchyStorageException ex) {
        log.error("Hierarchy storage failure", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable", ex.getMessage());
    }

    @ExceptionHandler(TeamAssemblyException.class)
    public ResponseEntity<ProblemDetail> handleAssembly(TeamAssemblyException ex) {
        log.error("Team assembly failure", ex);
        return problem(HttpStatus.BAD_GATEWAY, "Team assembly failed", ex.getMessage());
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(TimeoutException ex) {
        return problem(HttpStatus.GATEWAY_TIMEOUT, "Agent timed out", "The agent did not answer in time.");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatus(status);
        problem.setTitle(title);
        problem.setDetail(detail);
        return ResponseEntity.status(status).body(problem);
    }
}
