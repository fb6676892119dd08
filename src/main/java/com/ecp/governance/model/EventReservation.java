package com.ecp.governance.model;

import com.ecp.governance.repository.DecisionEventRepository;

/**
 * Claim on an event id. {@code sequence} stays pending until the event's
 * ledger entry is bound to it.
 */
public record EventReservation(String eventId,
                               long sequence,
                               String agentId,
                               String eventType,
                               long reservedAt) {

    public boolean pending() {
        return sequence == DecisionEventRepository.PENDING_SEQUENCE;
    }
}
