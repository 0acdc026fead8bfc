package com.evobus.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One routing decision as published to the routing-decisions queue by an instance's
 * model router. {@code decision_id} is optional; when present it makes redelivery
 * idempotent.
 */
public record RoutingDecisionMessage(
    @JsonProperty("decision_id") String decisionId,
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("complexity") ComplexityLevel complexity,
    @JsonProperty("model") String model,
    @JsonProperty("provider") String provider,
    @JsonProperty("score") Double score,
    @JsonProperty("outcome") RoutingOutcome outcome,
    @JsonProperty("response_time_ms") Long responseTimeMs,
    @JsonProperty("capabilities_required") List<String> capabilitiesRequired,
    @JsonProperty("preference") String preference,
    @JsonProperty("timestamp") Instant timestamp
) {
}
