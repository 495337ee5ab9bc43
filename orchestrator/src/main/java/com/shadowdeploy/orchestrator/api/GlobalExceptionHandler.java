package com.shadowdeploy.orchestrator.api;

import com.shadowdeploy.orchestrator.api.dto.ErrorResponse;
import com.shadowdeploy.orchestrator.engine.EngineSelectionException;
import com.shadowdeploy.orchestrator.service.DeploymentInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;

/**
 * Maps domain exceptions thrown by controllers to JSON error bodies.
 * Failed deployments are not errors here; they come back as 201 with
 * {@code status=failed}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EngineSelectionException.class)
    public ResponseEntity<ErrorResponse> handleEngineSelection(EngineSelectionException ex) {
        log.warn("Engine selection failed ({}): {}", ex.getReason(), ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of(ex), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DeploymentInProgressException.class)
    public ResponseEntity<ErrorResponse> handleDeploymentInProgress(DeploymentInProgressException ex) {
        log.warn(ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Deployment in progress", ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleLedgerIo(UncheckedIOException ex) {
        log.error("Cost ledger I/O failed: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ErrorResponse.of("Cost ledger unavailable", ex.getMessage()),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Invalid Request", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMalformedRequest(HttpMessageNotReadableException ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of("Bad Request", "Request body is missing or not valid JSON"),
                HttpStatus.BAD_REQUEST);
    }
}
