package com.ecp.governance.service;

import com.ecp.governance.model.Classification;
import com.ecp.governance.model.DecisionEvent;

/**
 * The acting agent's own assessment of a decision, requested at ingress when
 * the decision involved agency. Implementations may throw; the gate records a
 * conservative fallback instead.
 */
public interface SelfClassifier {

    /**
     * @return verdict fields (status, confidence, risk, reasoning, constraints);
     *         identity, version and timestamps are filled in by the caller
     */
    Classification selfClassify(DecisionEvent event);
}
