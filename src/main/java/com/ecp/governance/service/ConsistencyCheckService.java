package com.ecp.governance.service;

import com.ecp.governance.config.GovernanceConfig;
import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.model.CheckResult;
import com.ecp.governance.model.ConsistencyError;
import com.ecp.governance.model.ConsistencyReport;
import com.ecp.governance.model.Escalation;
import com.ecp.governance.model.EscalationSource;
import com.ecp.governance.model.EscalationStatus;
import com.ecp.governance.model.EventReservation;
import com.ecp.governance.model.HumanRuling;
import com.ecp.governance.model.LedgerEntry;
import com.ecp.governance.repository.ClassificationRepository;
import com.ecp.governance.repository.DecisionEventRepository;
import com.ecp.governance.repository.EscalationRepository;
import com.ecp.governance.repository.RulingRepository;
import com.ecp.governance.repository.ViolationRepository;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Independent audit of the stored state. Unlike ledger verification it never
 * stops at the first problem: every check runs and every error is reported.
 * Nothing found here is repaired by the check itself.
 */
@Service
public class ConsistencyCheckService {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyCheckService.class);

    static final String CHAIN_INTEGRITY = "chain_integrity";
    static final String EVENT_REFERENCES = "event_references";
    static final String CLASSIFICATION_LINKS = "classification_links";
    static final String CASE_CONSISTENCY = "case_consistency";
    static final String PRECEDENT_VALIDITY = "precedent_validity";
    static final String PENDING_ADMISSIONS = "pending_admissions";

    private final LedgerService ledgerService;
    private final DecisionEventRepository decisionEventRepo;
    private final ClassificationRepository classificationRepo;
    private final RulingRepository rulingRepo;
    private final EscalationRepository escalationRepo;
    private final ViolationRepository violationRepo;
    private final GovernanceConfig governanceConfig;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    private final AtomicReference<ConsistencyReport> lastReport = new AtomicReference<>();

    public ConsistencyCheckService(LedgerService ledgerService,
                                   DecisionEventRepository decisionEventRepo,
                                   ClassificationRepository classificationRepo,
                                   RulingRepository rulingRepo,
                                   EscalationRepository escalationRepo,
                                   ViolationRepository violationRepo,
                                   GovernanceConfig governanceConfig,
                                   MetricsConfig metricsConfig,
                                   Tracer tracer) {
        this.ledgerService = ledgerService;
        this.decisionEventRepo = decisionEventRepo;
        this.classificationRepo = classificationRepo;
        this.rulingRepo = rulingRepo;
        this.escalationRepo = escalationRepo;
        this.violationRepo = violationRepo;
        this.governanceConfig = governanceConfig;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    @Scheduled(fixedRateString = "${governance.consistency.check-interval-minutes:15}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "1")
    public void scheduledCheck() {
        if (!governanceConfig.getConsistency().isEnabled()) {
            return;
        }
        try {
            runCheck();
        } catch (Exception e) {
            log.error("Scheduled consistency check failed", e);
        }
    }

    public ConsistencyReport runCheck() {
        Map<String, Long> events = decisionEventRepo.scanAll();

        Map<String, CheckResult> checks = new LinkedHashMap<>();
        checks.put(CHAIN_INTEGRITY, runSingleCheck(CHAIN_INTEGRITY, "Hash chain integrity check", "critical",
                ledgerService::collectChainErrors));
        checks.put(EVENT_REFERENCES, runSingleCheck(EVENT_REFERENCES, "Event chain reference check", "high",
                () -> checkEventReferences(events)));
        checks.put(CLASSIFICATION_LINKS, runSingleCheck(CLASSIFICATION_LINKS, "Classification event linkage check", "high",
                () -> checkClassificationLinks(events)));
        checks.put(CASE_CONSISTENCY, runSingleCheck(CASE_CONSISTENCY, "Case consistency check", "medium",
                () -> checkCaseConsistency(events)));
        checks.put(PRECEDENT_VALIDITY, runSingleCheck(PRECEDENT_VALIDITY, "Precedent validity check", "medium",
                this::checkPrecedentValidity));
        checks.put(PENDING_ADMISSIONS, runSingleCheck(PENDING_ADMISSIONS, "Pending admission check", "high",
                this::checkPendingAdmissions));

        List<ConsistencyError> allErrors = new ArrayList<>();
        int failed = 0;
        for (CheckResult result : checks.values()) {
            if (result.failed()) {
                failed++;
                allErrors.addAll(result.errors());
            }
        }
        List<ConsistencyError> critical = allErrors.stream()
                .filter(e -> "critical".equals(e.severity()))
                .toList();

        ConsistencyReport report = ConsistencyReport.builder()
                .timestamp(System.currentTimeMillis())
                .checksRun(checks.size())
                .checksFailed(failed)
                .totalErrors(allErrors.size())
                .checks(checks)
                .status(allErrors.isEmpty() ? ConsistencyReport.HEALTHY : ConsistencyReport.DEGRADED)
                .criticalErrors(critical)
                .build();

        lastReport.set(report);
        metricsConfig.recordConsistencyRun(report.getStatus(), report.getTotalErrors());
        if (allErrors.isEmpty()) {
            log.info("Consistency check healthy: {} checks, {} events", checks.size(), events.size());
        } else {
            log.error("Consistency check DEGRADED: {} errors in {} checks ({} critical)",
                    allErrors.size(), failed, critical.size());
        }
        return report;
    }

    public ConsistencyReport getLastReport() {
        return lastReport.get();
    }

    private CheckResult runSingleCheck(String name, String description, String severity,
                                 Supplier<List<ConsistencyError>> check) {
        Span span = tracer.nextSpan()
                .name("consistency.check." + name)
                .tag("check.name", name)
                .start();

        List<ConsistencyError> errors;
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            errors = check.get();
            span.tag("check.errors", String.valueOf(errors.size()));
        } catch (Exception e) {
            span.error(e);
            log.error("Consistency check {} could not complete: {}", name, e.getMessage(), e);
            errors = List.of(new ConsistencyError(name, severity, null,
                    "Check could not complete: " + e.getMessage()));
        } finally {
            span.end();
        }

        // reported severity is "none" for a passing check
        return new CheckResult(description, errors.isEmpty() ? "none" : severity, errors);
    }

    private List<ConsistencyError> checkEventReferences(Map<String, Long> events) {
        List<ConsistencyError> errors = new ArrayList<>();
        for (Map.Entry<String, Long> e : events.entrySet()) {
            String eventId = e.getKey();
            long sequence = e.getValue();
            if (sequence == DecisionEventRepository.PENDING_SEQUENCE) {
                continue;
            }
            LedgerEntry entry = ledgerService.getEntry(sequence).orElse(null);
            if (entry == null) {
                errors.add(error(EVENT_REFERENCES, "high", eventId,
                        "Ledger entry " + sequence + " does not exist"));
            } else if (!EventGateService.LEDGER_ENTRY_TYPE.equals(entry.getEntryType())
                    || !eventId.equals(entry.getPayload().get("eventId"))) {
                errors.add(error(EVENT_REFERENCES, "high", eventId,
                        "Ledger entry " + sequence + " does not hold this event"));
            }
        }
        return errors;
    }

    private List<ConsistencyError> checkClassificationLinks(Map<String, Long> events) {
        List<ConsistencyError> errors = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : classificationRepo.indexSnapshot().entrySet()) {
            if (!isAdmitted(events, e.getKey())) {
                for (String classifierId : e.getValue()) {
                    errors.add(error(CLASSIFICATION_LINKS, "high",
                            ClassificationRepository.liveKey(e.getKey(), classifierId),
                            "Classification references unknown event " + e.getKey()));
                }
            }
        }
        return errors;
    }

    private List<ConsistencyError> checkCaseConsistency(Map<String, Long> events) {
        List<ConsistencyError> errors = new ArrayList<>();
        for (HumanRuling ruling : rulingRepo.findAll()) {
            if (!isAdmitted(events, ruling.getEventId())) {
                errors.add(error(CASE_CONSISTENCY, "medium", ruling.getEventId(),
                        "Ruling references unknown event"));
            }
        }
        for (Escalation escalation : escalationRepo.findAll()) {
            boolean referenceExists = escalation.getSource() == EscalationSource.VIOLATION
                    ? violationRepo.findById(escalation.getReferenceId()) != null
                    : isAdmitted(events, escalation.getReferenceId());
            if (!referenceExists) {
                errors.add(error(CASE_CONSISTENCY, "medium", escalation.getEscalationId(),
                        "Escalation references unknown " + escalation.getSource().getValue()
                                + " " + escalation.getReferenceId()));
            }
        }
        return errors;
    }

    private List<ConsistencyError> checkPrecedentValidity() {
        List<ConsistencyError> errors = new ArrayList<>();
        Map<String, HumanRuling> precedents = new LinkedHashMap<>();
        for (HumanRuling ruling : rulingRepo.findPrecedents()) {
            precedents.put(ruling.getEventId(), ruling);
            if (ruling.getApplicableEventTypes() == null || ruling.getApplicableEventTypes().isEmpty()
                    || ruling.getExpiresAt() <= ruling.getIssuedAt()) {
                errors.add(error(PRECEDENT_VALIDITY, "medium", ruling.getEventId(),
                        "Precedent has no event types or no validity window"));
            }
        }

        for (Escalation escalation : escalationRepo.findByStatus(EscalationStatus.RESOLVED_BY_PRECEDENT)) {
            HumanRuling precedent = precedents.get(escalation.getPrecedentEventId());
            if (precedent == null) {
                errors.add(error(PRECEDENT_VALIDITY, "medium", escalation.getEscalationId(),
                        "Resolved by missing precedent " + escalation.getPrecedentEventId()));
            } else if (escalation.getResolvedAt() >= precedent.getExpiresAt()) {
                errors.add(error(PRECEDENT_VALIDITY, "medium", escalation.getEscalationId(),
                        "Resolved by precedent " + precedent.getEventId() + " after it expired"));
            }
        }
        return errors;
    }

    /**
     * A pending reservation whose event is already in the ledger was never
     * bound; one with no entry past the grace period was abandoned.
     */
    private List<ConsistencyError> checkPendingAdmissions() {
        List<ConsistencyError> errors = new ArrayList<>();
        long graceMillis = governanceConfig.getIngress().getPendingGraceSeconds() * 1000L;
        long now = System.currentTimeMillis();
        for (EventReservation reservation : decisionEventRepo.scanPending()) {
            Optional<LedgerEntry> written = ledgerService.findEntrySince(
                    EventGateService.LEDGER_ENTRY_TYPE, reservation.eventId(), reservation.reservedAt());
            if (written.isPresent()) {
                errors.add(error(PENDING_ADMISSIONS, "high", reservation.eventId(),
                        "Event is in the ledger at " + written.get().getSequence() + " but its index is still pending"));
            } else if (now - reservation.reservedAt() >= graceMillis) {
                errors.add(error(PENDING_ADMISSIONS, "medium", reservation.eventId(),
                        "Reservation pending for " + (now - reservation.reservedAt()) / 1000
                                + "s with no ledger entry"));
            }
        }
        return errors;
    }

    private boolean isAdmitted(Map<String, Long> events, String eventId) {
        Long sequence = events.get(eventId);
        return sequence != null && sequence != DecisionEventRepository.PENDING_SEQUENCE;
    }

    private ConsistencyError error(String check, String severity, String referenceId, String message) {
        return new ConsistencyError(check, severity, referenceId, message);
    }
}
