package com.evobus.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AdvisoryType {
    LOW_SUCCESS_RATE("low_success_rate"),
    SLOW_RESPONSE("slow_response");

    private final String value;

    AdvisoryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
