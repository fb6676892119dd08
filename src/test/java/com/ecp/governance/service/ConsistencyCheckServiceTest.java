package com.ecp.governance.service;

import com.ecp.governance.config.GovernanceConfig;
import com.ecp.governance.config.MetricsConfig;
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
import com.ecp.governance.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsistencyCheckServiceTest {

    @Mock private LedgerService ledgerService;
    @Mock private DecisionEventRepository decisionEventRepo;
    @Mock private ClassificationRepository classificationRepo;
    @Mock private RulingRepository rulingRepo;
    @Mock private EscalationRepository escalationRepo;
    @Mock private ViolationRepository violationRepo;
    @Mock private MetricsConfig metricsConfig;

    private GovernanceConfig governanceConfig;
    private ConsistencyCheckService service;

    @BeforeEach
    void setUp() {
        governanceConfig = new GovernanceConfig();
        service = new ConsistencyCheckService(ledgerService, decisionEventRepo, classificationRepo,
                rulingRepo, escalationRepo, violationRepo, governanceConfig, metricsConfig, Tracer.NOOP);
    }

    private LedgerEntry eventEntry(long sequence, String eventId) {
        return LedgerEntry.builder()
                .sequence(sequence)
                .entryType(EventGateService.LEDGER_ENTRY_TYPE)
                .payload(Map.of("eventId", eventId))
                .build();
    }

    @Test
    void runCheck_cleanState_isHealthy() {
        when(decisionEventRepo.scanAll()).thenReturn(Map.of("evt_1", 0L));
        when(ledgerService.collectChainErrors()).thenReturn(List.of());
        when(ledgerService.getEntry(0L)).thenReturn(Optional.of(eventEntry(0, "evt_1")));
        when(classificationRepo.indexSnapshot()).thenReturn(Map.of("evt_1", Set.of("alpha")));

        ConsistencyReport report = service.runCheck();

        assertThat(report.getStatus()).isEqualTo(ConsistencyReport.HEALTHY);
        assertThat(report.getChecksRun()).isEqualTo(6);
        assertThat(report.getChecksFailed()).isZero();
        assertThat(report.getChecks().values()).allMatch(c -> "none".equals(c.severity()));
        assertThat(service.getLastReport()).isSameAs(report);
        verify(metricsConfig).recordConsistencyRun(ConsistencyReport.HEALTHY, 0);
    }

    @Test
    void runCheck_reportsEveryErrorAcrossChecks() {
        long now = System.currentTimeMillis();
        when(decisionEventRepo.scanAll()).thenReturn(Map.of(
                "evt_1", 0L,
                "evt_pending", DecisionEventRepository.PENDING_SEQUENCE));
        when(ledgerService.collectChainErrors()).thenReturn(List.of(
                new ConsistencyError(ConsistencyCheckService.CHAIN_INTEGRITY, "critical", "1", "hash mismatch")));
        when(ledgerService.getEntry(0L)).thenReturn(Optional.empty());
        when(classificationRepo.indexSnapshot()).thenReturn(Map.of("evt_ghost", Set.of("alpha", "beta")));
        when(rulingRepo.findAll()).thenReturn(List.of(
                TestDataFactory.createPrecedent("evt_ghost", "decision_publish", now - 1000, now + 1000)));
        when(escalationRepo.findAll()).thenReturn(List.of(
                TestDataFactory.createEscalation("esc_vio_x", EscalationSource.VIOLATION, "vio_x",
                        EscalationStatus.AWAITING_HUMAN_REVIEW)));
        when(violationRepo.findById("vio_x")).thenReturn(null);

        HumanRuling precedent = TestDataFactory.createPrecedent("evt_p", "decision_publish", now - 5000, now - 2000);
        when(rulingRepo.findPrecedents()).thenReturn(List.of(precedent));
        Escalation lateResolution = TestDataFactory.createEscalation("esc_evt_2", EscalationSource.CONSENSUS,
                "evt_2", EscalationStatus.RESOLVED_BY_PRECEDENT).toBuilder()
                .precedentEventId("evt_p")
                .resolvedAt(now - 1000)
                .build();
        when(escalationRepo.findByStatus(EscalationStatus.RESOLVED_BY_PRECEDENT)).thenReturn(List.of(lateResolution));

        ConsistencyReport report = service.runCheck();

        assertThat(report.getStatus()).isEqualTo(ConsistencyReport.DEGRADED);
        assertThat(report.getChecksFailed()).isEqualTo(5);
        // chain 1, event ref 1, classification 2, case 2, precedent 1
        assertThat(report.getTotalErrors()).isEqualTo(7);
        assertThat(report.getCriticalErrors()).hasSize(1)
                .first().extracting(ConsistencyError::referenceId).isEqualTo("1");
        assertThat(report.getChecks().get(ConsistencyCheckService.CLASSIFICATION_LINKS).severity())
                .isEqualTo("high");
        assertThat(report.getChecks().get(ConsistencyCheckService.PRECEDENT_VALIDITY).errors())
                .extracting(ConsistencyError::referenceId).containsExactly("esc_evt_2");
    }

    @Test
    void runCheck_failingCheck_isReportedAndOthersStillRun() {
        when(decisionEventRepo.scanAll()).thenReturn(Map.of());
        when(ledgerService.collectChainErrors()).thenThrow(new RuntimeException("aerospike timeout"));
        when(classificationRepo.indexSnapshot()).thenReturn(Map.of());

        ConsistencyReport report = service.runCheck();

        assertThat(report.getStatus()).isEqualTo(ConsistencyReport.DEGRADED);
        assertThat(report.getChecksFailed()).isEqualTo(1);
        assertThat(report.getCriticalErrors()).hasSize(1);
        assertThat(report.getCriticalErrors().get(0).message()).contains("aerospike timeout");
        verify(rulingRepo).findPrecedents();
    }

    @Test
    void runCheck_pendingReservations_flagsUnboundAndAbandoned() {
        long now = System.currentTimeMillis();
        EventReservation unbound = new EventReservation("evt_unbound", DecisionEventRepository.PENDING_SEQUENCE,
                "agent-1", "decision_publish", now - 5_000);
        EventReservation abandoned = new EventReservation("evt_abandoned", DecisionEventRepository.PENDING_SEQUENCE,
                "agent-1", "decision_publish", now - 120_000);
        EventReservation inFlight = new EventReservation("evt_in_flight", DecisionEventRepository.PENDING_SEQUENCE,
                "agent-1", "decision_publish", now - 1_000);
        when(decisionEventRepo.scanAll()).thenReturn(Map.of());
        when(classificationRepo.indexSnapshot()).thenReturn(Map.of());
        when(ledgerService.collectChainErrors()).thenReturn(List.of());
        when(decisionEventRepo.scanPending()).thenReturn(List.of(unbound, abandoned, inFlight));
        when(ledgerService.findEntrySince(eq(EventGateService.LEDGER_ENTRY_TYPE), eq("evt_unbound"), anyLong()))
                .thenReturn(Optional.of(eventEntry(9, "evt_unbound")));
        when(ledgerService.findEntrySince(eq(EventGateService.LEDGER_ENTRY_TYPE), eq("evt_abandoned"), anyLong()))
                .thenReturn(Optional.empty());
        when(ledgerService.findEntrySince(eq(EventGateService.LEDGER_ENTRY_TYPE), eq("evt_in_flight"), anyLong()))
                .thenReturn(Optional.empty());

        ConsistencyReport report = service.runCheck();

        List<ConsistencyError> errors = report.getChecks().get(ConsistencyCheckService.PENDING_ADMISSIONS).errors();
        assertThat(errors).extracting(ConsistencyError::referenceId).containsExactly("evt_unbound", "evt_abandoned");
        assertThat(errors).extracting(ConsistencyError::severity).containsExactly("high", "medium");
        assertThat(errors.get(0).message()).contains("ledger at 9");
        assertThat(report.getStatus()).isEqualTo(ConsistencyReport.DEGRADED);
    }

    @Test
    void scheduledCheck_disabled_doesNothing() {
        governanceConfig.getConsistency().setEnabled(false);

        service.scheduledCheck();

        verifyNoInteractions(decisionEventRepo, ledgerService);
        assertThat(service.getLastReport()).isNull();
    }
}
