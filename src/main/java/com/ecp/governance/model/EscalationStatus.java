package com.ecp.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationStatus {
    AWAITING_HUMAN_REVIEW("awaiting_human_review"),
    RESOLVED("resolved"),
    RESOLVED_BY_PRECEDENT("resolved_by_precedent");

    private final String value;

    EscalationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EscalationStatus fromValue(String raw) {
        if (raw != null) {
            for (EscalationStatus candidate : values()) {
                if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown escalation status: " + raw);
    }
}
