package com.ecp.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum CausationType {
    NATURAL("natural"),
    HUMAN("human"),
    AI_DECISION("ai_decision"),
    AI_ASSISTED("ai_assisted");

    private final String value;

    CausationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Strict lookup by wire value. Unlike the other enums, causation is only
     * accepted in its exact lower-case form since it is part of the ingress contract.
     */
    public static Optional<CausationType> parse(String raw) {
        if (raw == null) return Optional.empty();
        for (CausationType candidate : values()) {
            if (candidate.value.equals(raw)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static CausationType fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown causation: " + raw));
    }
}
