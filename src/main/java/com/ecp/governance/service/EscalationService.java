package com.ecp.governance.service;

import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.model.ConsensusRecord;
import com.ecp.governance.model.Escalation;
import com.ecp.governance.model.EscalationSource;
import com.ecp.governance.model.EscalationStatus;
import com.ecp.governance.model.HumanRuling;
import com.ecp.governance.model.Violation;
import com.ecp.governance.repository.EscalationRepository;
import com.ecp.governance.repository.RulingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    public static final String RESOLVED_BY_PRECEDENT = "PRECEDENT";

    private final EscalationRepository escalationRepo;
    private final RulingRepository rulingRepo;
    private final MetricsConfig metricsConfig;

    public EscalationService(EscalationRepository escalationRepo,
                             RulingRepository rulingRepo,
                             MetricsConfig metricsConfig) {
        this.escalationRepo = escalationRepo;
        this.rulingRepo = rulingRepo;
        this.metricsConfig = metricsConfig;
    }

    public static String violationEscalationId(String violationId) {
        return "esc_" + violationId;
    }

    public static String consensusEscalationId(String eventId) {
        return "esc_" + eventId;
    }

    public Escalation escalateViolation(Violation violation) {
        Escalation escalation = Escalation.builder()
                .escalationId(violationEscalationId(violation.getViolationId()))
                .source(EscalationSource.VIOLATION)
                .referenceId(violation.getViolationId())
                .reason(violation.getViolationType() + ": " + violation.getMessage())
                .status(EscalationStatus.AWAITING_HUMAN_REVIEW)
                .createdAt(System.currentTimeMillis())
                .build();
        return createOrGet(escalation);
    }

    /**
     * Open a review request for a divergent event, once per event. If an
     * unexpired precedent covers the event type the escalation is created
     * already resolved.
     */
    public Escalation escalateConsensus(ConsensusRecord record, String eventType) {
        String escalationId = consensusEscalationId(record.getEventId());
        Escalation existing = escalationRepo.findById(escalationId);
        if (existing != null) {
            return existing;
        }

        long now = System.currentTimeMillis();
        Escalation.EscalationBuilder builder = Escalation.builder()
                .escalationId(escalationId)
                .source(EscalationSource.CONSENSUS)
                .referenceId(record.getEventId())
                .reason(record.getTriggerReason())
                .status(EscalationStatus.AWAITING_HUMAN_REVIEW)
                .createdAt(now);

        Optional<HumanRuling> precedent = findApplicablePrecedent(eventType, now);
        if (precedent.isPresent()) {
            builder.status(EscalationStatus.RESOLVED_BY_PRECEDENT)
                    .resolvedAt(now)
                    .resolvedBy(RESOLVED_BY_PRECEDENT)
                    .precedentEventId(precedent.get().getEventId());
            log.info("Consensus escalation for event={} resolved by precedent from event={}",
                    record.getEventId(), precedent.get().getEventId());
        }
        return createOrGet(builder.build());
    }

    /** Latest unexpired precedent that lists the event type. */
    public Optional<HumanRuling> findApplicablePrecedent(String eventType, long now) {
        if (eventType == null) return Optional.empty();
        List<HumanRuling> precedents = rulingRepo.findPrecedents();
        for (int i = precedents.size() - 1; i >= 0; i--) {
            HumanRuling ruling = precedents.get(i);
            if (ruling.isPrecedentActiveAt(now) && ruling.appliesTo(eventType)) {
                return Optional.of(ruling);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the resolved escalation, or null if it does not exist
     * @throws IllegalStateException if it is no longer awaiting review
     */
    public Escalation resolveEscalation(String escalationId, String resolvedBy) {
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("resolvedBy is required");
        }
        Escalation escalation = escalationRepo.findById(escalationId);
        if (escalation == null) return null;

        if (!escalationRepo.resolve(escalationId, EscalationStatus.RESOLVED, resolvedBy, null)) {
            throw new IllegalStateException("Escalation " + escalationId + " is already " + escalation.getStatus());
        }
        log.info("Escalation resolved: id={}, by={}", escalationId, resolvedBy);
        refreshOpenCount();
        return escalationRepo.findById(escalationId);
    }

    /** Close the event's consensus escalation, if one is still open. */
    public void resolveForRuling(String eventId, String issuedBy) {
        String escalationId = consensusEscalationId(eventId);
        if (escalationRepo.resolve(escalationId, EscalationStatus.RESOLVED, issuedBy, null)) {
            log.info("Consensus escalation {} resolved by ruling from {}", escalationId, issuedBy);
            refreshOpenCount();
        }
    }

    public Escalation getEscalation(String escalationId) {
        return escalationRepo.findById(escalationId);
    }

    public List<Escalation> getEscalations(EscalationStatus status) {
        return escalationRepo.findByStatus(status);
    }

    public List<Escalation> getOpenEscalations() {
        return escalationRepo.findByStatus(EscalationStatus.AWAITING_HUMAN_REVIEW);
    }

    private Escalation createOrGet(Escalation escalation) {
        if (escalationRepo.createIfAbsent(escalation)) {
            log.info("Escalation created: id={}, source={}, status={}",
                    escalation.getEscalationId(), escalation.getSource(), escalation.getStatus());
            refreshOpenCount();
            return escalation;
        }
        log.debug("Escalation {} already exists", escalation.getEscalationId());
        Escalation existing = escalationRepo.findById(escalation.getEscalationId());
        return existing != null ? existing : escalation;
    }

    private void refreshOpenCount() {
        try {
            metricsConfig.updateOpenEscalationCount(getOpenEscalations().size());
        } catch (Exception e) {
            log.warn("Failed to refresh open escalation gauge: {}", e.getMessage());
        }
    }
}
