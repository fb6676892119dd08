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
@Schema(description = "Agreement summary over all current classifications of one event")
public class ConsensusRecord {

    public static final String REASON_NONE = "none";
    public static final String REASON_DIVERGENCE = "divergence_threshold";
    public static final String REASON_UNETHICAL = "unethical_classification";

    @Schema(description = "Scored event", example = "evt_3f9a0c1d22b4e8a1")
    private String eventId;

    @Schema(description = "Timestamp of the newest classification included", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Number of classifications compared", example = "2")
    private int classificationCount;

    @Schema(description = "Divergence of every classifier pair, ordered by classifier id")
    private List<PairwiseDivergence> pairwiseDivergences;

    @Schema(description = "Mean pairwise divergence", example = "0.325")
    private double divergenceScore;

    @Schema(description = "Largest pairwise divergence", example = "0.325")
    private double maxPairwiseDivergence;

    @Schema(description = "Aggregate compared against the threshold", example = "MAX")
    private String aggregation;

    @Schema(description = "Review threshold in force when scored", example = "0.3")
    private double threshold;

    @Schema(description = "Whether a human must review this event", example = "true")
    private boolean requiresHumanReview;

    @Schema(description = "Why review is required", example = "divergence_threshold",
            allowableValues = {"none", "divergence_threshold", "unethical_classification",
                    "unethical_classification+divergence_threshold"})
    private String triggerReason;

    @Schema(description = "Scale values of each classification")
    private List<ClassifierScore> perClassifierBreakdown;
}
