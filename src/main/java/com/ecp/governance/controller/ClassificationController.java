package com.ecp.governance.controller;

import com.ecp.governance.model.Classification;
import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.RiskEstimate;
import com.ecp.governance.service.ClassificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/decisions/{eventId}/classifications")
@Tag(name = "Classifications", description = "Independent ethical assessments of admitted decisions")
public class ClassificationController {

    private final ClassificationService classificationService;

    public ClassificationController(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    @PostMapping
    @Operation(summary = "Classify a decision",
               description = "Stores the classifier's assessment (archiving any earlier version) and rescores consensus.")
    public ResponseEntity<?> classify(@PathVariable String eventId, @RequestBody Map<String, Object> body) {
        String classifierId = RequestFields.optionalString(body, "classifierId");
        String reasoning = RequestFields.optionalString(body, "reasoning");
        Object status = body.get("ethicalStatus");
        Object risk = body.get("riskEstimate");
        Object confidence = body.get("confidence");

        if (status == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "ethicalStatus is required"));
        }
        if (risk == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "riskEstimate is required"));
        }
        if (!(confidence instanceof Number)) {
            return ResponseEntity.badRequest().body(Map.of("error", "confidence must be a number"));
        }

        Classification stored = classificationService.classifyEvent(
                eventId,
                classifierId,
                EthicalStatus.fromValue(status.toString()),
                ((Number) confidence).doubleValue(),
                RiskEstimate.fromValue(risk.toString()),
                reasoning);
        return ResponseEntity.ok(stored);
    }

    @GetMapping
    @Operation(summary = "List current classifications", description = "Live version per classifier, ordered by classifier id")
    public ResponseEntity<List<Classification>> getClassifications(@PathVariable String eventId) {
        return ResponseEntity.ok(classificationService.getClassifications(eventId));
    }

    @GetMapping("/{classifierId}/history")
    @Operation(summary = "Classification history",
               description = "Every version this classifier recorded for the decision, oldest first")
    public ResponseEntity<List<Classification>> getHistory(@PathVariable String eventId,
                                                           @PathVariable String classifierId) {
        return ResponseEntity.ok(classificationService.getHistory(eventId, classifierId));
    }
}
