package com.ecp.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Durable request for human review")
public class Escalation {

    @Schema(description = "Escalation id", example = "esc_vio_20250218_134244_123_5f1c2a9e")
    private String escalationId;

    @Schema(description = "What raised the escalation", example = "violation")
    private EscalationSource source;

    @Schema(description = "Violation id or event id the escalation refers to")
    private String referenceId;

    private String reason;
    private EscalationStatus status;
    private long createdAt;
    private long resolvedAt;            // 0 until resolved
    private String resolvedBy;          // reviewer id, or "PRECEDENT"
    private String precedentEventId;    // ruling applied when resolved by precedent
}
