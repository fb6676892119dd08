package com.ecp.governance.config;

import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.RiskEstimate;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Operator policy for divergence scoring. Scales, weights, threshold and the
 * aggregation mode are all tunable; none of them is fixed logic.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "consensus")
public class ConsensusConfig {

    public enum Aggregation { MAX, MEAN }

    // Which pairwise aggregate is compared against the review threshold.
    private Aggregation aggregation = Aggregation.MAX;

    // Aggregate divergence at or above this value requires human review.
    private double reviewThreshold = 0.3;

    private Weights weights = new Weights();

    private StatusScale statusScale = new StatusScale();

    private RiskScale riskScale = new RiskScale();

    @Data
    public static class Weights {
        private double status = 0.5;
        private double confidence = 0.25;
        private double risk = 0.25;
    }

    @Data
    public static class StatusScale {
        private double ethical = 0.0;
        private double permissible = 0.25;
        private double questionable = 0.5;
        private double unethical = 1.0;

        public double scoreOf(EthicalStatus status) {
            return switch (status) {
                case ETHICAL -> ethical;
                case PERMISSIBLE -> permissible;
                case QUESTIONABLE -> questionable;
                case UNETHICAL -> unethical;
            };
        }
    }

    @Data
    public static class RiskScale {
        private double low = 0.0;
        private double medium = 0.5;
        private double high = 1.0;

        public double scoreOf(RiskEstimate risk) {
            return switch (risk) {
                case LOW -> low;
                case MEDIUM -> medium;
                case HIGH -> high;
            };
        }
    }
}
