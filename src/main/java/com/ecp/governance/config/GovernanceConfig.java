package com.ecp.governance.config;

import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.RiskEstimate;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "governance")
public class GovernanceConfig {

    // Verdict recorded when the acting agent classifies its own decision at ingress.
    private Verdict selfClassification = new Verdict(
            EthicalStatus.PERMISSIBLE, 0.9, RiskEstimate.LOW,
            "Automated self-classification recorded at ingress.");

    // Conservative verdict recorded when self-classification fails.
    private Verdict fallbackClassification = new Verdict(
            EthicalStatus.QUESTIONABLE, 0.5, RiskEstimate.MEDIUM, null);

    private Consistency consistency = new Consistency();

    private Ingress ingress = new Ingress();

    private Violations violations = new Violations();

    @Data
    public static class Verdict {
        private EthicalStatus ethicalStatus;
        private double confidence;
        private RiskEstimate riskEstimate;
        private String reasoning;

        public Verdict() {
        }

        public Verdict(EthicalStatus ethicalStatus, double confidence,
                       RiskEstimate riskEstimate, String reasoning) {
            this.ethicalStatus = ethicalStatus;
            this.confidence = confidence;
            this.riskEstimate = riskEstimate;
            this.reasoning = reasoning;
        }
    }

    @Data
    public static class Consistency {
        private boolean enabled = true;
        private int checkIntervalMinutes = 15;
    }

    @Data
    public static class Ingress {
        // A reservation pending longer than this is treated as abandoned by its request.
        private long pendingGraceSeconds = 60;
        private long recoveryIntervalSeconds = 60;
        private int bindAttempts = 3;
    }

    @Data
    public static class Violations {
        private long indexRetrySeconds = 30;
    }
}
