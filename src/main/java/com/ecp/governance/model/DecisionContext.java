package com.ecp.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Causal context that must accompany every decision. Values are kept raw so
 * the gate can report every missing or malformed field in one rejection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Required causal context of a decision")
public class DecisionContext {

    @Schema(description = "Origin of the decision", example = "ai_decision",
            allowableValues = {"natural", "human", "ai_decision", "ai_assisted"})
    private String causation;

    @Schema(description = "Whether an agent exercised agency in this decision (must be a JSON boolean)", example = "true")
    private Object agencyPresent;

    @Schema(description = "Duty of care owed by the acting agent", example = "low")
    private String dutyOfCare;

    @Schema(description = "What the agent knew when deciding", example = "full")
    private String knowledgeLevel;

    @Schema(description = "Degree of control the agent had over the outcome", example = "direct")
    private String controlLevel;
}
