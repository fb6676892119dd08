package com.ecp.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationSource {
    VIOLATION("violation"),
    CONSENSUS("consensus");

    private final String value;

    EscalationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EscalationSource fromValue(String raw) {
        if (raw != null) {
            for (EscalationSource candidate : values()) {
                if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown escalation source: " + raw);
    }
}
