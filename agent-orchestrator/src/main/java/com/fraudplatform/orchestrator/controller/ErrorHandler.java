package com.fraudplatform.orchestrator.controller;

import com.fraudplatform.common.exception.ScoreExportException;
import com.fraudplatform.common.exception.WeightConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(WeightConfigurationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidWeight(WeightConfigurationException ex) {
        log.warn("Rejected weight update: {}", ex.getMessage());
        return Map.of(
            "code", "INVALID_WEIGHT",
            "agent", ex.getAgentName(),
            "message", ex.getMessage()
        );
    }

    @ExceptionHandler(ScoreExportException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleExportFailure(ScoreExportException ex) {
        log.error("Score export failed: {}", ex.getMessage(), ex);
        return Map.of(
            "code", "EXPORT_FAILED",
            "message", ex.getMessage()
        );
    }
}
