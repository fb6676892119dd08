package com.ecp.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifierScore {
    private String classifierId;
    private EthicalStatus ethicalStatus;
    private double statusScore;
    private double confidence;
    private RiskEstimate riskEstimate;
    private double riskScore;
}
