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
@Schema(description = "A decision submitted to the ingress gate")
public class DecisionRequest {

    @Schema(description = "Kind of action being taken", example = "publish_campaign")
    private String actionType;

    @Schema(description = "Human-readable description of the decision", example = "Send the spring newsletter to all subscribers")
    private String description;

    @Schema(description = "Arbitrary structured payload of the action")
    private Map<String, Object> payload;

    @Schema(description = "Identifier of the acting agent", example = "agent-marketing-01")
    private String agentId;

    @Schema(description = "Required causal context")
    private DecisionContext context;
}
