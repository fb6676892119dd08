package com.ecp.governance.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the governance error taxonomy onto JSON error bodies.
 */
@RestControllerAdvice(annotations = RestController.class)
public class GovernanceExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GovernanceExceptionHandler.class);

    @ExceptionHandler(IngressRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleIngressRejected(IngressRejectedException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "ingress_rejected");
        body.put("message", ex.getMessage());
        body.put("missingFields", ex.getMissingFields());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ReplayRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleReplay(ReplayRejectedException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "replay_rejected");
        body.put("message", ex.getMessage());
        body.put("eventId", ex.getEventId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(ConsistencyException.class)
    public ResponseEntity<Map<String, Object>> handleConsistency(ConsistencyException ex) {
        return ResponseEntity.unprocessableEntity().body(Map.of(
                "error", "consistency_violation",
                "message", ex.getMessage()));
    }

    @ExceptionHandler(IntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(IntegrityViolationException ex) {
        log.error("Integrity violation surfaced to API: {}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "integrity_violation");
        body.put("message", ex.getMessage());
        body.put("report", ex.getReport());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(LedgerAppendInDoubtException.class)
    public ResponseEntity<Map<String, Object>> handleAppendInDoubt(LedgerAppendInDoubtException ex) {
        log.error("Ledger append in doubt: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "error", "ledger_append_in_doubt",
                "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable root = ex.getMostSpecificCause();
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(root.getMessage())));
    }
}
