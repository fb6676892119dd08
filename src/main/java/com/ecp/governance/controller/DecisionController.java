package com.ecp.governance.controller;

import com.ecp.governance.model.DecisionEvent;
import com.ecp.governance.model.DecisionRequest;
import com.ecp.governance.service.EventGateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/decisions")
@Tag(name = "Decisions", description = "Mandatory ingress gate for agent decisions")
public class DecisionController {

    private final EventGateService eventGateService;

    public DecisionController(EventGateService eventGateService) {
        this.eventGateService = eventGateService;
    }

    @PostMapping
    @Operation(summary = "Submit a decision",
               description = "Validates the causal context, rejects replays and appends the decision to the ledger. "
                       + "Decisions with agency present are self-classified in the same call.")
    public ResponseEntity<Map<String, String>> enforceDecision(@RequestBody DecisionRequest request) {
        String eventId = eventGateService.enforceDecision(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("eventId", eventId));
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get an admitted decision")
    public ResponseEntity<DecisionEvent> getDecision(@PathVariable String eventId) {
        return eventGateService.getEvent(eventId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
