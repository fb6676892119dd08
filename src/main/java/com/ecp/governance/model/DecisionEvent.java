package com.ecp.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A validated decision recorded in the ledger")
public class DecisionEvent {

    @Schema(description = "Deterministic event id derived from action type, description and payload", example = "evt_3f9a0c1d22b4e8a1")
    private String eventId;

    @Schema(description = "Event type used for precedent matching", example = "decision_publish_campaign")
    private String eventType;

    private String actionType;
    private String description;
    private Map<String, Object> payload;
    private String agentId;

    private CausationType causation;
    private boolean agencyPresent;
    private String dutyOfCare;
    private String knowledgeLevel;
    private String controlLevel;

    @Schema(description = "Component that admitted the event", example = "event_gate")
    private String source;

    @Schema(description = "Admission timestamp in epoch milliseconds", example = "1739886764000")
    private long recordedAt;

    @Schema(description = "Sequence number of the ledger entry holding this event", example = "42")
    private long ledgerSequence;
}
