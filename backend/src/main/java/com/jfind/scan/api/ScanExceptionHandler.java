package com.jfind.scan.api;

import com.jfind.scan.persistence.CurrentSnapshotConflictException;
import com.jfind.scan.service.ScanNotFoundException;
import com.jfind.scan.util.ScanValidationException;
import com.jfind.scan.web.TraceIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ScanExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ScanExceptionHandler.class);

    @ExceptionHandler(ScanValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ScanValidationException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_scan_report", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_scan_report", "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_parameter", "Invalid value for " + ex.getName());
    }

    @ExceptionHandler(ScanNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ScanNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "scan_not_found", ex.getMessage());
    }

    @ExceptionHandler(CurrentSnapshotConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(CurrentSnapshotConflictException ex) {
        log.error("Current scan invariant violated for host {}", ex.getHost(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "current_scan_conflict", ex.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, String>> handleIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Scan report rejected by storage constraints", ex);
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_scan_report", "Scan report violates a storage constraint");
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<Map<String, String>> handleStorageFailure(RuntimeException ex) {
        log.error("Scan storage unavailable", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", "Scan storage is unavailable");
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("detail", detail);
        String traceId = MDC.get(TraceIdFilter.MDC_TRACE_ID);
        if (traceId != null) {
            body.put("trace_id", traceId);
        }
        return ResponseEntity.status(status).body(body);
    }
}
