package com.ecp.governance.service;

import com.ecp.governance.config.GovernanceConfig;
import com.ecp.governance.model.Classification;
import com.ecp.governance.model.DecisionEvent;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Records the configured default verdict ({@code governance.self-classification}).
 * Replace with an agent-specific bean to plug in a real self-assessment.
 */
@Component
public class ConfiguredSelfClassifier implements SelfClassifier {

    private final GovernanceConfig governanceConfig;

    public ConfiguredSelfClassifier(GovernanceConfig governanceConfig) {
        this.governanceConfig = governanceConfig;
    }

    @Override
    public Classification selfClassify(DecisionEvent event) {
        GovernanceConfig.Verdict verdict = governanceConfig.getSelfClassification();
        return Classification.builder()
                .ethicalStatus(verdict.getEthicalStatus())
                .confidence(verdict.getConfidence())
                .riskEstimate(verdict.getRiskEstimate())
                .reasoning(verdict.getReasoning())
                .constraints(List.of())
                .build();
    }
}
