package com.ecp.governance.exception;

/**
 * The decision maps to an event id that is already recorded. Callers should treat
 * the decision as already processed.
 */
public class ReplayRejectedException extends RuntimeException {

    private final String eventId;

    public ReplayRejectedException(String eventId) {
        super("Event " + eventId + " already exists - possible replay");
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
