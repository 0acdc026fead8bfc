package com.evobus.api;

import com.evobus.contract.ValidationException;
import com.evobus.coordinator.ConsensusTimeoutException;
import com.evobus.coordinator.RollbackException;
import com.evobus.proposal.InvalidTransitionException;
import com.evobus.proposal.PersistenceException;
import com.evobus.proposal.ProposalNotFoundException;
import com.evobus.queue.QueueUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "VALIDATION_ERROR",
 *   "reason": "invalid_change",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * {@code reason} is only present for validation errors.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        log.warn("Validation error {}: {}", ex.getErrorCode(), ex.getMessage());
        Map<String, Object> body = errorResponse("VALIDATION_ERROR", ex.getMessage());
        body.put("reason", ex.getErrorCode());
        return body;
    }

    @ExceptionHandler(ProposalNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ProposalNotFoundException ex) {
        return errorResponse("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return errorResponse("INVALID_TRANSITION", ex.getMessage());
    }

    @ExceptionHandler(ConsensusTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleConsensusTimeout(ConsensusTimeoutException ex) {
        return errorResponse("CONSENSUS_TIMEOUT", ex.getMessage());
    }

    @ExceptionHandler(QueueUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleQueueUnavailable(QueueUnavailableException ex) {
        log.error("Queue unavailable: {}", ex.getMessage());
        return errorResponse("QUEUE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(RollbackException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleRollbackFailure(RollbackException ex) {
        log.error("Rollback failed", ex);
        return errorResponse("ROLLBACK_FAILED", ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handlePersistence(PersistenceException ex) {
        log.error("Persistence error", ex);
        return errorResponse("PERSISTENCE_ERROR", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
