package com.cloudscheduler.engine.error;

import com.cloudscheduler.common.exception.FeatureExtractionException;
import com.cloudscheduler.common.exception.InsufficientHistoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    private ApiError build(ErrorCode code, String msg, Map<String, Object> details) {
        return new ApiError(clock.instant(), code, msg, details);
    }

    @ExceptionHandler(InsufficientHistoryException.class)
    public ResponseEntity<ApiError> handleInsufficientHistory(InsufficientHistoryException ex) {
        log.warn("[EngineApi] {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
                build(ErrorCode.INSUFFICIENT_HISTORY, ex.getDetail(),
                        Map.of("available", ex.getAvailable(), "required", ex.getRequired()))
        );
    }

    @ExceptionHandler(FeatureExtractionException.class)
    public ResponseEntity<ApiError> handleFeatureExtraction(FeatureExtractionException ex) {
        log.warn("[EngineApi] {}", ex.getMessage());
        return ResponseEntity.badRequest().body(
                build(ErrorCode.INVALID_INPUT, ex.getDetail(), Map.of("component", ex.getComponent()))
        );
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, ex.getReason(), Map.of())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex) {
        log.error("[EngineApi] Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, String.valueOf(ex.getMessage()), Map.of())
        );
    }
}
