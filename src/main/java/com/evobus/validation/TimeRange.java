package com.evobus.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/** Look-back window for effectiveness calculations. */
public enum TimeRange {
    LAST_HOUR("last_hour", Duration.ofHours(1)),
    LAST_DAY("last_day", Duration.ofDays(1)),
    LAST_WEEK("last_week", Duration.ofDays(7));

    private final String value;
    private final Duration length;

    TimeRange(String value, Duration length) {
        this.value = value;
        this.length = length;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Instant since(Instant now) {
        return now.minus(length);
    }

    @JsonCreator
    public static TimeRange fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown time range: " + raw));
    }
}
