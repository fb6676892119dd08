package com.ecp.governance.controller;

import com.ecp.governance.model.Severity;
import com.ecp.governance.model.Violation;
import com.ecp.governance.model.ViolationReport;
import com.ecp.governance.service.ViolationTrackerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/violations")
@Tag(name = "Violations", description = "Permanent record of compliance breaches")
public class ViolationController {

    private final ViolationTrackerService violationTracker;

    public ViolationController(ViolationTrackerService violationTracker) {
        this.violationTracker = violationTracker;
    }

    @PostMapping
    @Operation(summary = "Record a violation",
               description = "Blocking violations are escalated for human review and trigger an alert")
    public ResponseEntity<?> recordViolation(@RequestBody Map<String, Object> body) {
        String type = RequestFields.optionalString(body, "violationType");
        Object severity = body.get("severity");
        if (type == null || type.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "violationType is required"));
        }
        if (severity == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "severity is required"));
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> context = body.get("context") instanceof Map<?, ?> m
                ? (Map<String, Object>) m : Map.of();

        String violationId = violationTracker.recordViolation(
                type,
                Severity.fromValue(severity.toString()),
                RequestFields.optionalString(body, "message"),
                RequestFields.optionalString(body, "agentId"),
                RequestFields.optionalString(body, "functionName"),
                RequestFields.optionalString(body, "stackTrace"),
                context);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("violationId", violationId));
    }

    @GetMapping
    @Operation(summary = "Query violations",
               description = "All filters are optional and combine with AND. hours limits to the most recent N hours.")
    public ResponseEntity<List<Violation>> getViolations(
            @RequestParam(required = false) String agentId,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Integer hours) {
        Collection<Violation> base;
        if (agentId != null) {
            base = violationTracker.getViolationsByAgent(agentId);
        } else if (severity != null) {
            base = violationTracker.getViolationsBySeverity(Severity.fromValue(severity));
        } else if (type != null) {
            base = violationTracker.getViolationsByType(type);
        } else if (hours != null) {
            base = violationTracker.getRecentViolations(hours);
        } else {
            base = violationTracker.getAllViolations();
        }

        Severity severityFilter = severity != null ? Severity.fromValue(severity) : null;
        long cutoff = hours != null ? System.currentTimeMillis() - hours * 3_600_000L : Long.MIN_VALUE;

        List<Violation> results = new ArrayList<>();
        for (Violation v : base) {
            if (agentId != null && !agentId.equals(v.getAgentId())) continue;
            if (severityFilter != null && v.getSeverity() != severityFilter) continue;
            if (type != null && !type.equals(v.getViolationType())) continue;
            if (v.getTimestamp() < cutoff) continue;
            results.add(v);
        }
        results.sort(Comparator.comparingLong(Violation::getTimestamp).reversed());
        return ResponseEntity.ok(results);
    }

    @GetMapping("/{violationId}")
    @Operation(summary = "Get a violation")
    public ResponseEntity<Violation> getViolation(@PathVariable String violationId) {
        Violation violation = violationTracker.getViolation(violationId);
        if (violation == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(violation);
    }

    @GetMapping("/report")
    @Operation(summary = "Violation report", description = "Counts by severity, type and agent, plus 24h and 7d totals")
    public ResponseEntity<ViolationReport> getReport() {
        return ResponseEntity.ok(violationTracker.generateReport());
    }
}
