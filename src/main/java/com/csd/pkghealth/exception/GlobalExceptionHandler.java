package com.csd.pkghealth.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.concurrent.CompletionException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidManifestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidManifest(InvalidManifestException ex) {
        log.warn("Rejected manifest: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_manifest", ex.getMessage());
    }

    @ExceptionHandler(PackageCheckException.class)
    public ResponseEntity<Map<String, String>> handlePackageCheck(PackageCheckException ex) {
        log.warn("Package check failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "package_check_failed", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    // scans run asynchronously and arrive here wrapped
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, String>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof InvalidManifestException) {
            return handleInvalidManifest((InvalidManifestException) cause);
        }
        if (cause instanceof PackageCheckException) {
            return handlePackageCheck((PackageCheckException) cause);
        }
        if (cause instanceof IllegalArgumentException) {
            return handleBadRequest((IllegalArgumentException) cause);
        }
        log.error("Scan failed", cause);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", cause.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", message != null ? message : status.getReasonPhrase()));
    }
}
