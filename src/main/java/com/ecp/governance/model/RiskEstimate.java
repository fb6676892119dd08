package com.ecp.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskEstimate {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    RiskEstimate(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RiskEstimate fromValue(String raw) {
        if (raw != null) {
            for (RiskEstimate candidate : values()) {
                if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown risk estimate: " + raw);
    }
}
