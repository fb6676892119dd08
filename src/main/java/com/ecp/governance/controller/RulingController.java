package com.ecp.governance.controller;

import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.HumanRuling;
import com.ecp.governance.service.RulingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/rulings")
@Tag(name = "Rulings", description = "Final human assessments and precedents")
public class RulingController {

    private final RulingService rulingService;

    public RulingController(RulingService rulingService) {
        this.rulingService = rulingService;
    }

    @PostMapping
    @Operation(summary = "Issue a ruling",
               description = "One ruling per decision. A precedent resolves later consensus escalations "
                       + "for the listed event types until it expires.")
    public ResponseEntity<?> createRuling(@RequestBody Map<String, Object> body) {
        String eventId = RequestFields.optionalString(body, "eventId");
        Object assessment = body.get("finalAssessment");
        if (eventId == null || eventId.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "eventId is required"));
        }
        if (assessment == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "finalAssessment is required"));
        }

        boolean precedent = Boolean.TRUE.equals(body.get("precedentCreated"));
        Object validity = body.get("validityDays");
        int validityDays = validity instanceof Number n ? n.intValue() : 0;

        HumanRuling ruling = rulingService.createRuling(
                eventId,
                RequestFields.optionalString(body, "issuedBy"),
                EthicalStatus.fromValue(assessment.toString()),
                RequestFields.optionalString(body, "reasoning"),
                precedent,
                toStringList(body.get("applicableEventTypes")),
                validityDays);
        return ResponseEntity.status(HttpStatus.CREATED).body(ruling);
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get the ruling for a decision")
    public ResponseEntity<HumanRuling> getRuling(@PathVariable String eventId) {
        HumanRuling ruling = rulingService.getRuling(eventId);
        if (ruling == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(ruling);
    }

    @GetMapping("/precedents")
    @Operation(summary = "List precedent rulings", description = "Includes expired precedents")
    public ResponseEntity<List<HumanRuling>> getPrecedents() {
        return ResponseEntity.ok(rulingService.getPrecedents());
    }

    private List<String> toStringList(Object value) {
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("applicableEventTypes must be a list");
        }
        return list.stream().map(String::valueOf).toList();
    }
}
