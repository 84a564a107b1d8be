package io.pulsereader.ingestion.api;

import io.pulsereader.ingestion.api.exception.ErrorCode;
import io.pulsereader.ingestion.api.exception.IngestionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestion(IngestionException e) {
        return errorResponse(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException e) {
        logger.error("Unhandled error: {}", e.getMessage(), e);
        return errorResponse(ErrorCode.INTERNAL_ERROR, "Internal error");
    }

    private ResponseEntity<Map<String, Object>> errorResponse(ErrorCode code, String message) {
        return ResponseEntity.status(code.getStatus()).body(Map.of(
                "error", message,
                "code", code.name(),
                "timestamp", Instant.now().toString()
        ));
    }
}
