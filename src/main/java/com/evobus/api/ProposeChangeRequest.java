package com.evobus.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ProposeChangeRequest(
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("change") Map<String, Object> change,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
}
