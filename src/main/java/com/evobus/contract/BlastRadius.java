package com.evobus.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Qualitative scope of what a change can break. Declared in ascending order.
 */
public enum BlastRadius {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    BlastRadius(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean exceeds(BlastRadius limit) {
        return compareTo(limit) > 0;
    }

    @JsonCreator
    public static BlastRadius fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown blast radius: " + raw));
    }
}
