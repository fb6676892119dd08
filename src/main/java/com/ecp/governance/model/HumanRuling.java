package com.ecp.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Final human assessment of an event, optionally reusable as a precedent")
public class HumanRuling {

    @Schema(description = "Ruled event", example = "evt_3f9a0c1d22b4e8a1")
    private String eventId;

    @Schema(description = "Reviewer who issued the ruling", example = "ethics-board")
    private String issuedBy;

    @Schema(description = "Final verdict", example = "permissible")
    private EthicalStatus finalAssessment;

    private String reasoning;

    @Schema(description = "Whether this ruling resolves future matching escalations")
    private boolean precedentCreated;

    @Schema(description = "Event types the precedent applies to", example = "[\"decision_publish_campaign\"]")
    private List<String> applicableEventTypes;

    @Schema(description = "Validity window of the precedent in days", example = "90")
    private int validityDays;

    private long issuedAt;

    @Schema(description = "Precedent expiry in epoch milliseconds (0 when no precedent)")
    private long expiresAt;

    public boolean isPrecedentActiveAt(long now) {
        return precedentCreated && expiresAt > now;
    }

    public boolean appliesTo(String eventType) {
        return applicableEventTypes != null && applicableEventTypes.contains(eventType);
    }
}
