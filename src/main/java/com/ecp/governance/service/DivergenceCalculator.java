package com.ecp.governance.service;

import com.ecp.governance.config.ConsensusConfig;
import com.ecp.governance.model.Classification;
import com.ecp.governance.model.ClassifierScore;
import com.ecp.governance.model.PairwiseDivergence;
import org.springframework.stereotype.Component;

/**
 * Weighted L1 distance between two classifications, with status and risk
 * mapped onto [0, 1] through the configured scales.
 */
@Component
public class DivergenceCalculator {

    private final ConsensusConfig consensusConfig;

    public DivergenceCalculator(ConsensusConfig consensusConfig) {
        this.consensusConfig = consensusConfig;
    }

    public PairwiseDivergence compare(Classification a, Classification b) {
        ConsensusConfig.Weights w = consensusConfig.getWeights();
        double statusDelta = Math.abs(statusScore(a) - statusScore(b));
        double confidenceDelta = Math.abs(a.getConfidence() - b.getConfidence());
        double riskDelta = Math.abs(riskScore(a) - riskScore(b));

        double divergence = w.getStatus() * statusDelta
                + w.getConfidence() * confidenceDelta
                + w.getRisk() * riskDelta;

        return PairwiseDivergence.builder()
                .classifierA(a.getClassifierId())
                .classifierB(b.getClassifierId())
                .statusDelta(statusDelta)
                .confidenceDelta(confidenceDelta)
                .riskDelta(riskDelta)
                .divergence(divergence)
                .build();
    }

    public double divergence(Classification a, Classification b) {
        return compare(a, b).getDivergence();
    }

    public ClassifierScore score(Classification c) {
        return ClassifierScore.builder()
                .classifierId(c.getClassifierId())
                .ethicalStatus(c.getEthicalStatus())
                .statusScore(statusScore(c))
                .confidence(c.getConfidence())
                .riskEstimate(c.getRiskEstimate())
                .riskScore(riskScore(c))
                .build();
    }

    private double statusScore(Classification c) {
        return consensusConfig.getStatusScale().scoreOf(c.getEthicalStatus());
    }

    private double riskScore(Classification c) {
        return consensusConfig.getRiskScale().scoreOf(c.getRiskEstimate());
    }
}
