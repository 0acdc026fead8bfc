package com.evobus.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One run of a validation check. Append-only.
 */
public record ValidationCheckRecord(
    @JsonProperty("check_id") String checkId,
    @JsonProperty("result") CheckResult result,
    @JsonProperty("runtime_ms") Long runtimeMs,
    @JsonProperty("timestamp") Instant timestamp
) {
}
