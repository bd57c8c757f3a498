package com.jreinhal.tieredrag.exception;

import com.jreinhal.tieredrag.embedding.EmbeddingUnavailableException;
import com.jreinhal.tieredrag.extraction.AllTiersExhaustedException;
import com.jreinhal.tieredrag.extraction.ExtractionCancelledException;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.ingest.IngestionException;
import com.jreinhal.tieredrag.retrieval.SearchBackendUnavailableException;
import com.jreinhal.tieredrag.vector.VectorStoreException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, sanitizeExceptionMessage(ex.getMessage(), "Invalid request"));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, sanitizeExceptionMessage(ex.getMessage(), "Not found"));
    }

    @ExceptionHandler(ResourceConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ResourceConflictException ex) {
        return error(HttpStatus.CONFLICT, sanitizeExceptionMessage(ex.getMessage(), "Conflict"));
    }

    @ExceptionHandler(ExtractionCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(ExtractionCancelledException ex) {
        log.info("Extraction cancelled: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Extraction cancelled");
    }

    @ExceptionHandler(AllTiersExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleExhausted(AllTiersExhaustedException ex) {
        log.warn("Extraction failed on every tier: {}", ex.getFailures());
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<ExtractionTier, String> entry : ex.getFailures().entrySet()) {
            failures.put(entry.getKey().configKey(), sanitizeExceptionMessage(entry.getValue(), "failed"));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "No extraction tier produced text");
        body.put("failures", failures);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler({SearchBackendUnavailableException.class, EmbeddingUnavailableException.class,
            VectorStoreException.class})
    public ResponseEntity<Map<String, Object>> handleBackendUnavailable(RuntimeException ex) {
        log.warn("Backend unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Search backend unavailable");
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestion(IngestionException ex) {
        log.error("Ingestion failed", ex);
        return error(HttpStatus.BAD_GATEWAY, "Document could not be indexed");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file is too large");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message, "timestamp", Instant.now().toString()));
    }

    static String sanitizeExceptionMessage(String message, String fallback) {
        if (message == null || message.isBlank()) {
            return fallback;
        }
        // Anything resembling a path or a stack trace falls back to the generic message.
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return fallback;
        }
        return message;
    }
}
