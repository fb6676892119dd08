package com.ecp.governance.service;

import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.HumanRuling;
import com.ecp.governance.repository.RulingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class RulingService {

    private static final Logger log = LoggerFactory.getLogger(RulingService.class);

    static final String LEDGER_ENTRY_TYPE = "human_ruling";
    private static final long DAY_MS = 86_400_000L;

    private final ConsistencyGuard consistencyGuard;
    private final RulingRepository rulingRepo;
    private final EscalationService escalationService;
    private final LedgerService ledgerService;

    public RulingService(ConsistencyGuard consistencyGuard,
                         RulingRepository rulingRepo,
                         EscalationService escalationService,
                         LedgerService ledgerService) {
        this.consistencyGuard = consistencyGuard;
        this.rulingRepo = rulingRepo;
        this.escalationService = escalationService;
        this.ledgerService = ledgerService;
    }

    /**
     * Record the final human assessment of an event. A ruling that creates a
     * precedent resolves later consensus escalations for the listed event
     * types until it expires.
     *
     * @throws IllegalStateException if the event already has a ruling
     */
    public HumanRuling createRuling(String eventId, String issuedBy, EthicalStatus finalAssessment,
                                    String reasoning, boolean precedentCreated,
                                    List<String> applicableEventTypes, int validityDays) {
        if (issuedBy == null || issuedBy.isBlank()) {
            throw new IllegalArgumentException("issuedBy is required");
        }
        if (finalAssessment == null) {
            throw new IllegalArgumentException("finalAssessment is required");
        }
        List<String> eventTypes = applicableEventTypes != null ? List.copyOf(applicableEventTypes) : List.of();
        if (precedentCreated) {
            if (eventTypes.isEmpty()) {
                throw new IllegalArgumentException("A precedent needs at least one applicable event type");
            }
            if (validityDays <= 0) {
                throw new IllegalArgumentException("validityDays must be > 0 for a precedent");
            }
        }
        consistencyGuard.requireEvent(eventId);

        long now = System.currentTimeMillis();
        HumanRuling ruling = HumanRuling.builder()
                .eventId(eventId)
                .issuedBy(issuedBy)
                .finalAssessment(finalAssessment)
                .reasoning(reasoning)
                .precedentCreated(precedentCreated)
                .applicableEventTypes(eventTypes)
                .validityDays(precedentCreated ? validityDays : 0)
                .issuedAt(now)
                .expiresAt(precedentCreated ? now + validityDays * DAY_MS : 0)
                .build();

        if (!rulingRepo.createIfAbsent(ruling)) {
            throw new IllegalStateException("Event " + eventId + " already has a ruling");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("eventId", eventId);
        payload.put("issuedBy", issuedBy);
        payload.put("finalAssessment", finalAssessment.getValue());
        payload.put("precedentCreated", precedentCreated);
        payload.put("applicableEventTypes", eventTypes);
        payload.put("expiresAt", ruling.getExpiresAt());
        ledgerService.append(LEDGER_ENTRY_TYPE, payload);

        escalationService.resolveForRuling(eventId, issuedBy);

        log.info("Ruling issued: event={}, by={}, assessment={}, precedent={}",
                eventId, issuedBy, finalAssessment.getValue(), precedentCreated);
        return ruling;
    }

    public HumanRuling getRuling(String eventId) {
        return rulingRepo.findByEventId(eventId);
    }

    public List<HumanRuling> getPrecedents() {
        return rulingRepo.findPrecedents();
    }
}
