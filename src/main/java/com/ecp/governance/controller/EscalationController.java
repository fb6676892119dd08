package com.ecp.governance.controller;

import com.ecp.governance.model.Escalation;
import com.ecp.governance.model.EscalationStatus;
import com.ecp.governance.service.EscalationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/escalations")
@Tag(name = "Escalations", description = "Human review requests raised by blocking violations and divergent consensus")
public class EscalationController {

    private final EscalationService escalationService;

    public EscalationController(EscalationService escalationService) {
        this.escalationService = escalationService;
    }

    @GetMapping
    @Operation(summary = "List escalations",
               description = "Defaults to escalations awaiting human review. Pass status=all for every escalation.")
    public ResponseEntity<List<Escalation>> getEscalations(
            @RequestParam(defaultValue = "awaiting_human_review") String status) {
        if ("all".equalsIgnoreCase(status)) {
            return ResponseEntity.ok(escalationService.getEscalations(null));
        }
        return ResponseEntity.ok(escalationService.getEscalations(EscalationStatus.fromValue(status)));
    }

    @GetMapping("/{escalationId}")
    @Operation(summary = "Get an escalation")
    public ResponseEntity<Escalation> getEscalation(@PathVariable String escalationId) {
        Escalation escalation = escalationService.getEscalation(escalationId);
        if (escalation == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(escalation);
    }

    @PostMapping("/{escalationId}/resolve")
    @Operation(summary = "Resolve an escalation", description = "Marks an escalation awaiting review as RESOLVED")
    public ResponseEntity<?> resolve(@PathVariable String escalationId,
                                     @RequestBody Map<String, String> body) {
        String resolvedBy = body.get("resolvedBy");
        if (resolvedBy == null || resolvedBy.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "resolvedBy is required"));
        }
        Escalation resolved = escalationService.resolveEscalation(escalationId, resolvedBy);
        if (resolved == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(resolved);
    }
}
