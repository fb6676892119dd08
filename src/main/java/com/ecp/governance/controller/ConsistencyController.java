package com.ecp.governance.controller;

import com.ecp.governance.model.ConsistencyReport;
import com.ecp.governance.service.ConsistencyCheckService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/consistency")
@Tag(name = "Consistency", description = "Independent audit of ledger, classifications, rulings and escalations")
public class ConsistencyController {

    private final ConsistencyCheckService consistencyCheckService;

    public ConsistencyController(ConsistencyCheckService consistencyCheckService) {
        this.consistencyCheckService = consistencyCheckService;
    }

    @PostMapping("/check")
    @Operation(summary = "Run a consistency check now",
               description = "Runs every check and reports all failures. Nothing is repaired.")
    public ResponseEntity<ConsistencyReport> runCheck() {
        return ResponseEntity.ok(consistencyCheckService.runCheck());
    }

    @GetMapping("/last")
    @Operation(summary = "Get the last consistency report", description = "Returns 204 if no check has run yet")
    public ResponseEntity<ConsistencyReport> getLastReport() {
        ConsistencyReport report = consistencyCheckService.getLastReport();
        if (report == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(report);
    }
}
