package com.ecp.governance.service;

import com.ecp.governance.config.GovernanceConfig;
import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.exception.ClassificationFailureException;
import com.ecp.governance.exception.IngressRejectedException;
import com.ecp.governance.exception.LedgerAppendInDoubtException;
import com.ecp.governance.exception.ReplayRejectedException;
import com.ecp.governance.model.CausationType;
import com.ecp.governance.model.Classification;
import com.ecp.governance.model.DecisionContext;
import com.ecp.governance.model.DecisionEvent;
import com.ecp.governance.model.DecisionRequest;
import com.ecp.governance.model.EventReservation;
import com.ecp.governance.model.LedgerEntry;
import com.ecp.governance.model.Severity;
import com.ecp.governance.repository.DecisionEventRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mandatory entry point for every agent decision. A decision is admitted only
 * with its full causal context, at most once, and, when an agent exercised
 * agency, never without a classification.
 */
@Service
public class EventGateService {

    private static final Logger log = LoggerFactory.getLogger(EventGateService.class);

    public static final String SOURCE = "event_gate";
    static final String LEDGER_ENTRY_TYPE = "decision_event";

    private final DecisionEventRepository decisionEventRepo;
    private final LedgerService ledgerService;
    private final ClassificationService classificationService;
    private final SelfClassifier selfClassifier;
    private final ViolationTrackerService violationTracker;
    private final GovernanceConfig governanceConfig;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper = new ObjectMapper();

    // serializes recovery so a resubmission and the sweep never resolve the same reservation twice
    private final ReentrantLock recoveryLock = new ReentrantLock();

    private enum Recovery { NONE, BOUND, RELEASED }

    public EventGateService(DecisionEventRepository decisionEventRepo,
                            LedgerService ledgerService,
                            ClassificationService classificationService,
                            SelfClassifier selfClassifier,
                            ViolationTrackerService violationTracker,
                            GovernanceConfig governanceConfig,
                            MetricsConfig metricsConfig) {
        this.decisionEventRepo = decisionEventRepo;
        this.ledgerService = ledgerService;
        this.classificationService = classificationService;
        this.selfClassifier = selfClassifier;
        this.violationTracker = violationTracker;
        this.governanceConfig = governanceConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Admit a decision into the ledger.
     *
     * @return the deterministic event id
     * @throws IngressRejectedException if any required field is missing or invalid; nothing is written
     * @throws ReplayRejectedException  if the same decision was already admitted
     * @throws LedgerAppendInDoubtException if the ledger write may or may not have landed; the
     *         reservation is kept and resolved by {@link #recoverPendingAdmissions()}
     */
    @Observed(name = "ingress.enforce", contextualName = "enforce-decision")
    public String enforceDecision(DecisionRequest request) {
        List<String> missing = validate(request);
        if (!missing.isEmpty()) {
            metricsConfig.recordIngress("rejected");
            log.warn("Decision rejected, missing or invalid fields: {}", missing);
            recordMissingContext(request, missing);
            throw new IngressRejectedException(missing);
        }

        DecisionContext ctx = request.getContext();
        Map<String, Object> payload = request.getPayload() != null ? request.getPayload() : Map.of();
        String eventId = LedgerHasher.eventId(objectMapper, request.getActionType(), request.getDescription(), payload);
        String eventType = "decision_" + request.getActionType();

        if (!decisionEventRepo.reserve(eventId, request.getAgentId(), eventType)) {
            Recovery recovery = recoverPending(eventId);
            if (recovery == Recovery.BOUND) {
                metricsConfig.recordIngress("recovered");
                log.info("Resubmitted decision completed an earlier admission: event={}", eventId);
                return eventId;
            }
            if (recovery != Recovery.RELEASED || !decisionEventRepo.reserve(eventId, request.getAgentId(), eventType)) {
                metricsConfig.recordIngress("replay");
                log.warn("Replay rejected: event {} already admitted", eventId);
                violationTracker.recordViolation("replay_attempt", Severity.WARNING,
                        "Duplicate submission of event " + eventId,
                        request.getAgentId(), "enforceDecision", Map.of("eventId", eventId));
                throw new ReplayRejectedException(eventId);
            }
        }

        DecisionEvent event = DecisionEvent.builder()
                .eventId(eventId)
                .eventType(eventType)
                .actionType(request.getActionType())
                .description(request.getDescription())
                .payload(payload)
                .agentId(request.getAgentId())
                .causation(CausationType.fromValue(ctx.getCausation()))
                .agencyPresent((Boolean) ctx.getAgencyPresent())
                .dutyOfCare(ctx.getDutyOfCare())
                .knowledgeLevel(ctx.getKnowledgeLevel())
                .controlLevel(ctx.getControlLevel())
                .source(SOURCE)
                .recordedAt(System.currentTimeMillis())
                .build();

        LedgerEntry entry;
        try {
            entry = ledgerService.append(LEDGER_ENTRY_TYPE, toLedgerPayload(event), eventId);
        } catch (LedgerAppendInDoubtException e) {
            metricsConfig.recordIngress("error");
            log.error("Ledger append for event {} is in doubt, reservation kept for recovery", eventId);
            throw e;
        } catch (RuntimeException e) {
            releaseReservation(eventId, e);
            metricsConfig.recordIngress("error");
            throw e;
        }

        try {
            bindWithRetry(eventId, entry.getSequence());
        } catch (RuntimeException e) {
            metricsConfig.recordIngress("error");
            log.error("Event {} is in the ledger at sequence {} but could not be indexed, left for recovery",
                    eventId, entry.getSequence(), e);
            throw e;
        }
        event.setLedgerSequence(entry.getSequence());

        metricsConfig.recordIngress("accepted");
        log.info("Decision admitted: event={}, type={}, agent={}, seq={}",
                eventId, eventType, request.getAgentId(), entry.getSequence());

        if (event.isAgencyPresent()) {
            classifyAtIngress(event);
        }
        return eventId;
    }

    /**
     * Resolve reservations left pending by a request that failed part way.
     * Each one is either bound to the ledger entry its request wrote, and
     * self-classified, or released when no such entry exists.
     */
    @Scheduled(fixedRateString = "${governance.ingress.recovery-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${governance.ingress.recovery-interval-seconds:60}")
    public void recoverPendingAdmissions() {
        List<EventReservation> pending;
        try {
            pending = decisionEventRepo.scanPending();
        } catch (Exception e) {
            log.error("Failed to scan pending reservations", e);
            return;
        }
        int resolved = 0;
        for (EventReservation reservation : pending) {
            try {
                if (recoverPending(reservation.eventId()) != Recovery.NONE) {
                    resolved++;
                }
            } catch (Exception e) {
                log.error("Recovery of pending event {} failed", reservation.eventId(), e);
            }
        }
        if (resolved > 0) {
            log.info("Resolved {} of {} pending reservations", resolved, pending.size());
        }
    }

    /** Reconstruct the admitted event from its ledger entry. */
    public Optional<DecisionEvent> getEvent(String eventId) {
        Long sequence = decisionEventRepo.findSequence(eventId);
        if (sequence == null) return Optional.empty();
        return ledgerService.getEntry(sequence).map(this::toEvent);
    }

    private Recovery recoverPending(String eventId) {
        long graceMillis = governanceConfig.getIngress().getPendingGraceSeconds() * 1000L;
        recoveryLock.lock();
        try {
            EventReservation reservation = decisionEventRepo.findReservation(eventId);
            if (reservation == null || !reservation.pending()
                    || System.currentTimeMillis() - reservation.reservedAt() < graceMillis) {
                return Recovery.NONE;
            }

            Optional<LedgerEntry> written = ledgerService.findEntrySince(
                    LEDGER_ENTRY_TYPE, eventId, reservation.reservedAt());
            if (written.isEmpty()) {
                decisionEventRepo.release(eventId);
                log.warn("Released abandoned reservation for event {}: no ledger entry", eventId);
                return Recovery.RELEASED;
            }

            LedgerEntry entry = written.get();
            bindWithRetry(eventId, entry.getSequence());
            log.warn("Bound abandoned reservation for event {} to ledger entry {}", eventId, entry.getSequence());
            DecisionEvent event = toEvent(entry);
            if (event.isAgencyPresent()) {
                classifyAtIngress(event);
            }
            return Recovery.BOUND;
        } finally {
            recoveryLock.unlock();
        }
    }

    private void bindWithRetry(String eventId, long sequence) {
        int attempts = Math.max(1, governanceConfig.getIngress().getBindAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                decisionEventRepo.bindSequence(eventId, sequence);
                return;
            } catch (RuntimeException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.warn("Binding event {} to sequence {} failed (attempt {}/{}): {}",
                        eventId, sequence, attempt, attempts, e.getMessage());
            }
        }
    }

    private void releaseReservation(String eventId, RuntimeException cause) {
        try {
            decisionEventRepo.release(eventId);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Reservation for event {} could not be released, left for recovery", eventId, e);
        }
    }

    private void recordMissingContext(DecisionRequest request, List<String> missing) {
        Map<String, Object> violationContext = new LinkedHashMap<>();
        violationContext.put("missingFields", missing);
        violationContext.put("actionType", request != null ? request.getActionType() : null);
        try {
            violationTracker.recordViolation("missing_context", Severity.AUDIT,
                    "Decision rejected at ingress: missing or invalid " + String.join(", ", missing),
                    request != null ? request.getAgentId() : null, "enforceDecision", violationContext);
        } catch (RuntimeException e) {
            log.error("Failed to record missing_context violation", e);
        }
    }

    private void classifyAtIngress(DecisionEvent event) {
        String classifierId = event.getAgentId() != null ? event.getAgentId() : "acting_agent";
        try {
            Classification verdict = requestSelfClassification(event);
            classificationService.record(verdict.toBuilder()
                    .eventId(event.getEventId())
                    .classifierId(classifierId)
                    .constraints(verdict.getConstraints() != null ? verdict.getConstraints() : List.of())
                    .selfClassification(true)
                    .build());
        } catch (RuntimeException e) {
            // covers a verdict that was produced but could not be validated or stored
            log.warn("Self-classification failed for event={}: {}", event.getEventId(), e.getMessage());
            if (selfClassificationStored(event.getEventId(), classifierId)) {
                log.warn("Self-classification for event={} was stored before the failure, no fallback recorded",
                        event.getEventId());
                return;
            }
            recordFallback(event, classifierId, e.getMessage());
        }
    }

    private boolean selfClassificationStored(String eventId, String classifierId) {
        try {
            Classification current = classificationService.findCurrent(eventId, classifierId);
            return current != null && current.isSelfClassification();
        } catch (RuntimeException e) {
            log.warn("Could not check stored classification for event={}: {}", eventId, e.getMessage());
            return false;
        }
    }

    private Classification requestSelfClassification(DecisionEvent event) {
        Classification verdict;
        try {
            verdict = selfClassifier.selfClassify(event);
        } catch (RuntimeException e) {
            throw new ClassificationFailureException(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
        if (verdict == null || verdict.getEthicalStatus() == null || verdict.getRiskEstimate() == null) {
            throw new ClassificationFailureException("self-classifier returned no verdict");
        }
        return verdict;
    }

    private void recordFallback(DecisionEvent event, String classifierId, String reason) {
        GovernanceConfig.Verdict fallback = governanceConfig.getFallbackClassification();
        String reasoning = fallback.getReasoning() != null
                ? fallback.getReasoning()
                : "Agent failed to self-classify: " + reason;
        try {
            classificationService.record(Classification.builder()
                    .eventId(event.getEventId())
                    .classifierId(classifierId)
                    .ethicalStatus(fallback.getEthicalStatus())
                    .confidence(fallback.getConfidence())
                    .riskEstimate(fallback.getRiskEstimate())
                    .reasoning(reasoning)
                    .constraints(List.of(Classification.REQUIRES_EXTERNAL_REVIEW))
                    .selfClassification(true)
                    .build());
        } catch (RuntimeException e) {
            log.error("Fallback classification could not be stored for event={}", event.getEventId(), e);
            violationTracker.recordViolation("unclassified_event", Severity.BLOCKING,
                    "Event " + event.getEventId() + " has no classification: " + e.getMessage(),
                    event.getAgentId(), "enforceDecision", stackTraceOf(e),
                    Map.of("eventId", event.getEventId()));
        }
    }

    List<String> validate(DecisionRequest request) {
        List<String> missing = new ArrayList<>();
        if (request == null || isBlank(request.getActionType())) {
            missing.add("actionType");
        }
        DecisionContext ctx = request != null ? request.getContext() : null;
        if (ctx == null) {
            missing.addAll(List.of("causation", "agencyPresent", "dutyOfCare", "knowledgeLevel", "controlLevel"));
            return missing;
        }

        if (isBlank(ctx.getCausation())) {
            missing.add("causation");
        } else if (CausationType.parse(ctx.getCausation()).isEmpty()) {
            missing.add("causation (invalid value)");
        }
        if (ctx.getAgencyPresent() == null) {
            missing.add("agencyPresent");
        } else if (!(ctx.getAgencyPresent() instanceof Boolean)) {
            missing.add("agencyPresent (not boolean)");
        }
        if (isBlank(ctx.getDutyOfCare())) missing.add("dutyOfCare");
        if (isBlank(ctx.getKnowledgeLevel())) missing.add("knowledgeLevel");
        if (isBlank(ctx.getControlLevel())) missing.add("controlLevel");
        return missing;
    }

    private DecisionEvent toEvent(LedgerEntry entry) {
        DecisionEvent event = objectMapper.convertValue(entry.getPayload(), DecisionEvent.class);
        event.setLedgerSequence(entry.getSequence());
        return event;
    }

    private Map<String, Object> toLedgerPayload(DecisionEvent event) {
        Map<String, Object> map = objectMapper.convertValue(event, new TypeReference<Map<String, Object>>() {});
        map.remove("ledgerSequence");
        return map;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String stackTraceOf(Throwable t) {
        StringBuilder sb = new StringBuilder(t.toString());
        for (StackTraceElement element : t.getStackTrace()) {
            sb.append("\n\tat ").append(element);
        }
        return sb.toString();
    }
}
