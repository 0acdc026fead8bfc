package com.evobus.coordinator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Fleet verdict on a proposal. Rejection is a normal outcome, not an error.
 */
public enum ConsensusOutcome {
    APPROVED("approved"),
    REJECTED("rejected");

    private final String value;

    ConsensusOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConsensusOutcome fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown consensus decision: " + raw));
    }
}
