package com.evobus.analysis;

import com.evobus.contract.ComplexityLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record PerformanceAdvisory(
    @JsonProperty("type") AdvisoryType type,
    @JsonProperty("model") String model,
    @JsonProperty("complexity") ComplexityLevel complexity,
    @JsonProperty("observed") double observed,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("message") String message,
    @JsonProperty("timestamp") Instant timestamp
) {
}
