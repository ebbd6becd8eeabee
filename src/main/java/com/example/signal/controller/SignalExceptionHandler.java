package com.example.signal.controller;

import com.example.signal.service.SignalAnalysisException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SignalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SignalExceptionHandler.class);

    @ExceptionHandler(SignalAnalysisException.class)
    public ResponseEntity<Map<String, String>> handleAnalysisFailure(SignalAnalysisException e) {
        log.error(">>> Internal analysis fault", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("status", "failed", "error", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(
            HttpMessageNotReadableException e) {
        log.warn(">>> Unreadable event body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("status", "failed", "error", "Invalid JSON"));
    }
}
