package com.evobus.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RoutingOutcome {
    ROUTED("routed"),
    SUCCESS("success"),
    FAILURE("failure");

    private final String value;

    RoutingOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    @JsonCreator
    public static RoutingOutcome fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown routing outcome: " + raw));
    }
}
