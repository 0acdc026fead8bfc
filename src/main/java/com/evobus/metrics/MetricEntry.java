package com.evobus.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record MetricEntry(
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("metric_name") String metricName,
    @JsonProperty("value") double value,
    @JsonProperty("timestamp") Instant timestamp
) {
}
