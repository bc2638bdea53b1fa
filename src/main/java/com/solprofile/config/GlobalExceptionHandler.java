package com.solprofile.config;

import com.solprofile.exception.BehaviorAnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BehaviorAnalysisException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysisFailure(BehaviorAnalysisException e) {
        log.error("Behavior analysis failed for wallet {} at stage {}", e.getWalletAddress(), e.getStage(), e);
        Map<String, Object> body = body("Behavior analysis failed", e.getMessage());
        body.put("wallet", e.getWalletAddress());
        body.put("stage", e.getStage());
        return ResponseEntity.status(500).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return ResponseEntity.status(400).body(body("Bad request", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unhandled exception: ", e);
        return ResponseEntity.status(500).body(body("Internal server error", e.getMessage()));
    }

    // message may be null, so no Map.of
    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
