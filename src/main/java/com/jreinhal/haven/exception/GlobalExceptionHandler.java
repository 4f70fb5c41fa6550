package com.jreinhal.haven.exception;

import com.jreinhal.haven.anonymizer.VoiceAnonymizationException;
import com.jreinhal.haven.filter.CorrelationIdFilter;
import com.jreinhal.haven.service.AuditService;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(HavenException.class)
    public ResponseEntity<Map<String, Object>> handleHaven(HavenException ex) {
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.UNAUTHENTICATED || kind == ErrorKind.PERMISSION_DENIED) {
            log.warn("{}: {}", kind, ex.getMessage());
        } else {
            log.debug("{}: {}", kind, ex.getMessage());
        }
        return body(kind.getStatus(), kind.name(), ex.getMessage());
    }

    @ExceptionHandler(VoiceAnonymizationException.class)
    public ResponseEntity<Map<String, Object>> handleAnonymization(VoiceAnonymizationException ex) {
        log.error("Voice anonymization failed: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_FAILURE", ex.getMessage());
    }

    @ExceptionHandler(AuditService.AuditFailureException.class)
    public ResponseEntity<Map<String, Object>> handleAuditFailure(AuditService.AuditFailureException ex) {
        log.error("Operation halted by audit failure: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_FAILURE", "Audit trail unavailable, operation aborted");
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrentWrite(OptimisticLockingFailureException ex) {
        log.warn("Concurrent modification rejected: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, ErrorKind.CONFLICT.name(), "The record was modified concurrently. Reload and retry.");
    }

    // Unique indexes catch the create race that the existsBy pre-checks leave open.
    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicateKey(DuplicateKeyException ex) {
        log.warn("Write rejected by a unique index");
        return body(HttpStatus.CONFLICT, ErrorKind.CONFLICT.name(), "A record with the same unique value already exists");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadSize(MaxUploadSizeExceededException ex) {
        return body(HttpStatus.PAYLOAD_TOO_LARGE, ErrorKind.INVALID_ARGUMENT.name(), "File too large. Maximum size is 10 MB");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleMalformed(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT.name(), "Malformed request");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT.name(), sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        String correlationId = CorrelationIdFilter.currentCorrelationId();
        String message = correlationId == null ? "Internal server error" : "Internal server error (ref " + correlationId + ")";
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "SERVICE_FAILURE", message);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", error, "message", message != null ? message : "", "timestamp", Instant.now().toString()));
    }

    private static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        // Never echo paths, class names or stack-trace fragments
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }
}
