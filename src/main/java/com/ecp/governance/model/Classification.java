package com.ecp.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An independent ethical assessment of one decision event by one classifier")
public class Classification {

    public static final String REQUIRES_EXTERNAL_REVIEW = "requires_external_review";

    @Schema(description = "Classified event", example = "evt_3f9a0c1d22b4e8a1")
    private String eventId;

    @Schema(description = "Classifier (agent or reviewer) id", example = "ethics-reviewer-2")
    private String classifierId;

    @Schema(description = "Verdict", example = "questionable")
    private EthicalStatus ethicalStatus;

    @Schema(description = "Classifier confidence in [0, 1]", example = "0.6")
    private double confidence;

    @Schema(description = "Estimated risk", example = "medium")
    private RiskEstimate riskEstimate;

    @Schema(description = "Free-text justification")
    private String reasoning;

    @Schema(description = "Handling constraints, e.g. requires_external_review")
    private List<String> constraints;

    @Schema(description = "True when the acting agent classified its own decision at ingress")
    private boolean selfClassification;

    @Schema(description = "Version of this (event, classifier) classification, starting at 1", example = "1")
    private int version;

    @Schema(description = "Classification time in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "When this version was superseded (0 for the live version)", example = "0")
    private long archivedAt;

    public boolean requiresExternalReview() {
        return constraints != null && constraints.contains(REQUIRES_EXTERNAL_REVIEW);
    }
}
