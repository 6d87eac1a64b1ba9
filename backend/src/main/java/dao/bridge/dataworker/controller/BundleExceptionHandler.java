package dao.bridge.dataworker.controller;

import dao.bridge.dataworker.exception.BundleNotFoundException;
import dao.bridge.dataworker.exception.BundleStateException;
import dao.bridge.dataworker.exception.ReconciliationAbortedException;
import dao.bridge.dataworker.exception.StaleChainStateException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "dao.bridge.dataworker.controller")
public class BundleExceptionHandler {

    @ExceptionHandler(StaleChainStateException.class)
    public ResponseEntity<Map<String, Object>> onStaleChain(StaleChainStateException e) {
        Map<String, Object> body = body("STALE_CHAIN_STATE", e.getMessage());
        body.put("chainId", e.getChainId());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(BundleStateException.class)
    public ResponseEntity<Map<String, Object>> onBundleState(BundleStateException e) {
        Map<String, Object> body = body("ILLEGAL_BUNDLE_STATE", e.getMessage());
        body.put("bundleId", e.getBundleId());
        body.put("bundleStatus", e.getStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(BundleNotFoundException.class)
    public ResponseEntity<Map<String, Object>> onNotFound(BundleNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ReconciliationAbortedException.class)
    public ResponseEntity<Map<String, Object>> onAborted(ReconciliationAbortedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("ABORTED", e.getMessage()));
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(body("BAD_REQUEST", e.getMessage() == null ? "Invalid request" : e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
        log.error("Request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("ERROR", e.getMessage() == null ? "Internal server error" : e.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now().toEpochMilli());
        return body;
    }
}
