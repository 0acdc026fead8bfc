package com.evobus.coordinator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record LearnedPattern(
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("category") String category,
    @JsonProperty("pattern") Map<String, Object> pattern,
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("timestamp") Instant timestamp
) {
}
