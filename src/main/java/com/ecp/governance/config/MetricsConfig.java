package com.ecp.governance.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger openEscalations;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.openEscalations = registry.gauge("escalation.open.count", new AtomicInteger(0));
    }

    public void recordIngress(String outcome) {
        Counter.builder("ingress.decision.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordLedgerAppend(String entryType) {
        Counter.builder("ledger.append.count")
                .tag("entry_type", entryType)
                .register(registry)
                .increment();
    }

    public void recordClassification(String ethicalStatus, boolean fallback) {
        Counter.builder("classification.recorded.count")
                .tag("ethical_status", ethicalStatus)
                .tag("fallback", String.valueOf(fallback))
                .register(registry)
                .increment();
    }

    public void recordConsensus(boolean requiresHumanReview, double maxDivergence) {
        Counter.builder("consensus.scored.count")
                .tag("review", String.valueOf(requiresHumanReview))
                .register(registry)
                .increment();

        DistributionSummary.builder("consensus.max_divergence")
                .register(registry)
                .record(maxDivergence);
    }

    public void recordViolation(String severity, String violationType) {
        Counter.builder("violation.recorded.count")
                .tag("severity", severity)
                .tag("violation_type", violationType)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordConsistencyRun(String status, int totalErrors) {
        Counter.builder("consistency.check.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("consistency.check.errors")
                .register(registry)
                .record(totalErrors);
    }

    public void updateOpenEscalationCount(int count) {
        openEscalations.set(count);
    }
}
