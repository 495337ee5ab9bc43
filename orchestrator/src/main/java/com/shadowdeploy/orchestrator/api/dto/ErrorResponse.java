package com.shadowdeploy.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shadowdeploy.orchestrator.engine.EngineSelectionException;

import java.util.List;

/**
 * Error body of every non-2xx answer. {@code availableEngines} is present
 * only for engine-selection errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, List<String> availableEngines) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }

    public static ErrorResponse of(EngineSelectionException e) {
        return new ErrorResponse(e.getReason().title(), e.getMessage(), e.getAvailableEngines());
    }
}
