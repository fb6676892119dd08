package com.ecp.governance.controller;

import com.ecp.governance.model.ConsensusRecord;
import com.ecp.governance.service.ConsensusScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/consensus")
@Tag(name = "Consensus", description = "Divergence scoring across classifications")
public class ConsensusController {

    private final ConsensusScoringService consensusScoringService;

    public ConsensusController(ConsensusScoringService consensusScoringService) {
        this.consensusScoringService = consensusScoringService;
    }

    @PostMapping("/{eventId}/score")
    @Operation(summary = "Score a decision",
               description = "Recomputes the consensus record. Returns 204 when fewer than two classifications exist.")
    public ResponseEntity<ConsensusRecord> score(@PathVariable String eventId) {
        return consensusScoringService.scoreEvent(eventId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get the stored consensus record")
    public ResponseEntity<ConsensusRecord> getConsensus(@PathVariable String eventId) {
        ConsensusRecord record = consensusScoringService.getConsensus(eventId);
        if (record == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(record);
    }
}
