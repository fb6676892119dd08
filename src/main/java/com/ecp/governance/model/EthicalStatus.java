package com.ecp.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Closed set of verdicts a classifier may reach about a decision event. */
public enum EthicalStatus {
    ETHICAL("ethical"),
    PERMISSIBLE("permissible"),
    QUESTIONABLE("questionable"),
    UNETHICAL("unethical");

    private final String value;

    EthicalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EthicalStatus fromValue(String raw) {
        if (raw != null) {
            for (EthicalStatus candidate : values()) {
                if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown ethical status: " + raw);
    }
}
