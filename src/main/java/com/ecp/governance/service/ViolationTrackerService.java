package com.ecp.governance.service;

import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.model.Escalation;
import com.ecp.governance.model.Severity;
import com.ecp.governance.model.Violation;
import com.ecp.governance.model.ViolationReport;
import com.ecp.governance.repository.ViolationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Records compliance breaches. Blocking violations are escalated to a human
 * and trigger a best-effort alert.
 */
@Service
public class ViolationTrackerService {

    private static final Logger log = LoggerFactory.getLogger(ViolationTrackerService.class);

    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);
    private static final long HOUR_MS = 3_600_000L;

    private final ViolationRepository violationRepo;
    private final EscalationService escalationService;
    private final NotificationService notificationService;
    private final MetricsConfig metricsConfig;

    public ViolationTrackerService(ViolationRepository violationRepo,
                                   EscalationService escalationService,
                                   NotificationService notificationService,
                                   MetricsConfig metricsConfig) {
        this.violationRepo = violationRepo;
        this.escalationService = escalationService;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
    }

    public String recordViolation(String violationType, Severity severity, String message,
                                  String agentId, String functionName, Map<String, Object> context) {
        return recordViolation(violationType, severity, message, agentId, functionName, null, context);
    }

    /**
     * Persist a violation and, when blocking, escalate it. The record is
     * written before any escalation or notification is attempted.
     *
     * @return the new violation id
     */
    public String recordViolation(String violationType, Severity severity, String message,
                                  String agentId, String functionName, String stackTrace,
                                  Map<String, Object> context) {
        if (violationType == null || violationType.isBlank()) {
            throw new IllegalArgumentException("violationType is required");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity is required");
        }

        long now = System.currentTimeMillis();
        Violation violation = Violation.builder()
                .violationId(newViolationId(now))
                .violationType(violationType)
                .severity(severity)
                .message(message)
                .timestamp(now)
                .agentId(agentId)
                .functionName(functionName)
                .stackTrace(stackTrace)
                .context(context != null ? context : Map.of())
                .build();

        violationRepo.save(violation);
        metricsConfig.recordViolation(severity.getValue(), violationType);
        log.warn("Violation recorded: id={}, type={}, severity={}, agent={}",
                violation.getViolationId(), violationType, severity.getValue(), agentId);

        if (severity == Severity.BLOCKING) {
            Escalation escalation = escalationService.escalateViolation(violation);
            try {
                notificationService.notifyEscalation(escalation, violation);
            } catch (Exception e) {
                metricsConfig.recordNotification("dispatch", "error");
                log.error("Failed to dispatch notification for violation={}: {}",
                        violation.getViolationId(), e.getMessage(), e);
            }
        }
        return violation.getViolationId();
    }

    public Violation getViolation(String violationId) {
        return violationRepo.findById(violationId);
    }

    public Collection<Violation> getViolationsByAgent(String agentId) {
        return violationRepo.findByAgent(agentId);
    }

    public Collection<Violation> getViolationsBySeverity(Severity severity) {
        return violationRepo.findBySeverity(severity);
    }

    public Collection<Violation> getViolationsByType(String violationType) {
        return violationRepo.findByType(violationType);
    }

    public Collection<Violation> getBlockingViolations() {
        return violationRepo.findBySeverity(Severity.BLOCKING);
    }

    public Collection<Violation> getRecentViolations(int hours) {
        if (hours < 0) {
            throw new IllegalArgumentException("hours must be >= 0");
        }
        return violationRepo.findSince(System.currentTimeMillis() - hours * HOUR_MS);
    }

    public Collection<Violation> getAllViolations() {
        return violationRepo.findAll();
    }

    public ViolationReport generateReport() {
        Collection<Violation> all = violationRepo.findAll();
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> byAgent = new TreeMap<>();
        for (Violation v : all) {
            byType.merge(v.getViolationType(), 1, Integer::sum);
            if (v.getAgentId() != null) {
                byAgent.merge(v.getAgentId(), 1, Integer::sum);
            }
        }

        return ViolationReport.builder()
                .timestamp(System.currentTimeMillis())
                .totalViolations(all.size())
                .blockingViolations(violationRepo.findBySeverity(Severity.BLOCKING).size())
                .warningViolations(violationRepo.findBySeverity(Severity.WARNING).size())
                .auditViolations(violationRepo.findBySeverity(Severity.AUDIT).size())
                .violationsByType(byType)
                .violationsByAgent(byAgent)
                .recent24h(getRecentViolations(24).size())
                .recent7d(getRecentViolations(168).size())
                .build();
    }

    private String newViolationId(long now) {
        return "vio_" + ID_FORMAT.format(Instant.ofEpochMilli(now)) + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
