package com.evobus.routing;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConsumerHealth {
    RUNNING("running"),
    BACKING_OFF("backing_off"),
    HALTED("halted");

    private final String value;

    ConsumerHealth(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
