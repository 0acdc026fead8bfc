package com.evobus.safety;

import com.evobus.contract.BlastRadius;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk tolerance for one agent type. A proposal takes a copy of this at creation time
 * and never looks at the registry again.
 */
public record SafetyProfile(
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("error_threshold") double errorThreshold,
    @JsonProperty("needs_consensus") boolean needsConsensus,
    @JsonProperty("max_blast_radius") BlastRadius maxBlastRadius,
    @JsonProperty("auto_rollback") boolean autoRollback,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("cost_factor") double costFactor
) {

    public static final double DEFAULT_ERROR_THRESHOLD = 0.05;

    /** Profile applied to agent types nobody registered. */
    public static SafetyProfile defaults(String agentType) {
        return new SafetyProfile(agentType, DEFAULT_ERROR_THRESHOLD, false, BlastRadius.LOW, true, 1.0, 1.0);
    }
}
