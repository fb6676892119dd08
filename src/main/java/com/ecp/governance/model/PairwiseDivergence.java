package com.ecp.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairwiseDivergence {
    private String classifierA;
    private String classifierB;
    private double statusDelta;
    private double confidenceDelta;
    private double riskDelta;
    private double divergence;
}
