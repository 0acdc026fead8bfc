package com.evobus.coordinator;

import com.evobus.safety.SafetyProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/** Published to consensus-requests when a proposal needs a fleet vote. */
public record ConsensusRequest(
    @JsonProperty("proposal_id") String proposalId,
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("change") Map<String, Object> change,
    @JsonProperty("safety_profile") SafetyProfile safetyProfile,
    @JsonProperty("impact_score") double impactScore,
    @JsonProperty("risk_score") double riskScore,
    @JsonProperty("priority_score") double priorityScore,
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("timestamp") Instant timestamp
) {
}
